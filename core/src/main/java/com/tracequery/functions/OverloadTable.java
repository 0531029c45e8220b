package com.tracequery.functions;

import com.tracequery.config.DuplicatePolicy;
import com.tracequery.descriptor.FunctionSignature;
import com.tracequery.exception.FunctionNotFoundException;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.exception.SignatureMismatchException;
import com.tracequery.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Exact-match overload table: function name to the signatures registered under it.
 *
 * <p>A call resolves only to a signature whose argument types equal the call's argument
 * types element-wise, arity included. There is no implicit widening or coercion.
 *
 * <p>The table is filled during registry initialization and only read afterwards;
 * reads need no locking once the table has been safely published.
 *
 * @param <T> the stored signature type
 */
public final class OverloadTable<T extends FunctionSignature> {

    private final String kind;
    private final DuplicatePolicy duplicatePolicy;
    private final Map<String, List<T>> overloads = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Creates an empty table.
     *
     * @param kind label used in error messages, e.g. "scalar UDF"
     * @param duplicatePolicy what to do when a signature is registered twice
     */
    public OverloadTable(String kind, DuplicatePolicy duplicatePolicy) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    /**
     * Registers a signature.
     *
     * @param signature the signature
     * @throws InvalidDescriptorException if the (name, argument types) pair is already
     *         registered and the policy is {@link DuplicatePolicy#REJECT}
     * @throws IllegalStateException if the table is frozen
     */
    public void register(T signature) {
        Objects.requireNonNull(signature, "signature");
        if (frozen) {
            throw new IllegalStateException("Cannot register into a frozen " + kind + " table");
        }
        List<T> existing = overloads.computeIfAbsent(signature.name(), k -> new ArrayList<>());
        for (int i = 0; i < existing.size(); i++) {
            if (existing.get(i).matches(signature.argTypes())) {
                if (duplicatePolicy == DuplicatePolicy.REJECT) {
                    throw new InvalidDescriptorException(
                        "Duplicate " + kind + " signature: " + signature.name() + signature.argTypes());
                }
                existing.set(i, signature);
                return;
            }
        }
        existing.add(signature);
    }

    /**
     * Rejects further registrations.
     */
    void freeze() {
        frozen = true;
    }

    public boolean contains(String name) {
        return overloads.containsKey(name);
    }

    /**
     * Resolves a call to its result type.
     *
     * @param name the function name
     * @param argTypes the argument types of the call
     * @return the result type of the matching signature
     * @throws FunctionNotFoundException if no signature is registered under the name
     * @throws SignatureMismatchException if none of the name's signatures matches exactly
     */
    public DataType resolve(String name, List<DataType> argTypes) {
        return resolveSignature(name, argTypes).resultType();
    }

    /**
     * Resolves a call to the registered signature it matches.
     *
     * @param name the function name
     * @param argTypes the argument types of the call
     * @return the matching signature
     * @throws FunctionNotFoundException if no signature is registered under the name
     * @throws SignatureMismatchException if none of the name's signatures matches exactly
     */
    public T resolveSignature(String name, List<DataType> argTypes) {
        List<T> candidates = overloads.get(name);
        if (candidates == null) {
            throw new FunctionNotFoundException(capitalize(kind) + " not found: " + name, name);
        }
        for (T candidate : candidates) {
            if (candidate.matches(argTypes)) {
                return candidate;
            }
        }
        throw new SignatureMismatchException(name, argTypes,
            candidates.stream().map(FunctionSignature::argTypes).toList());
    }

    /**
     * Returns the signatures registered under a name, in registration order.
     *
     * @param name the function name
     * @return an unmodifiable list, empty if the name is unknown
     */
    public List<T> overloads(String name) {
        List<T> candidates = overloads.get(name);
        return candidates == null ? List.of() : Collections.unmodifiableList(candidates);
    }

    /**
     * Returns every registered name.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(overloads.keySet());
    }

    /**
     * Returns the total number of registered signatures.
     */
    public int size() {
        return overloads.values().stream().mapToInt(List::size).sum();
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
