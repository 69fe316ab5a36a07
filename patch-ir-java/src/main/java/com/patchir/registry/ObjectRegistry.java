package com.patchir.registry;

import com.patchir.ir.IrModel.Domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of known object types: arity, domain and symbol semantics, plus
 * argument-dependent arity overrides.
 *
 * The registry is mutable until {@link #seal()} is called; afterwards it is a
 * read-only lookup table that may be shared between builds.
 */
public class ObjectRegistry {

    private final Map<String, ObjectSpec> objects = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final Map<String, OverrideRule> overrides = new LinkedHashMap<>();
    private final List<RegistryDocument.Source> sources = new ArrayList<>();
    private boolean sealed;

    /** Creates an empty registry. Most callers want {@link #withBuiltins()}. */
    public ObjectRegistry() {}

    /** Creates a registry pre-populated with the Pd vanilla catalog. */
    public static ObjectRegistry withBuiltins() {
        ObjectRegistry registry = new ObjectRegistry();
        registry.sources.add(RegistryDocument.Source.of(BuiltinObjects.LIBRARY, BuiltinObjects.LIBRARY_VERSION));
        BuiltinObjects.registerAll(registry);
        return registry;
    }

    // --- Mutation ---

    /** Registers a spec; an existing spec with the same key is replaced. */
    public void register(ObjectSpec spec) {
        checkMutable();
        objects.put(spec.key, spec);
        for (String alias : spec.aliases) {
            aliases.put(alias, spec.key);
        }
    }

    /** Adds an override rule; an existing rule for the same key is replaced. */
    public void addOverride(OverrideRule rule) {
        checkMutable();
        overrides.put(rule.matchKey(), rule);
    }

    /**
     * Loads an overlay file. The file is parsed and validated in full before
     * anything is registered.
     *
     * @throws RegistryReader.RegistryParseException if the file is missing or malformed
     * @throws IllegalStateException if the registry is sealed
     */
    public void loadJson(Path path) {
        checkMutable();
        apply(new RegistryReader().read(path));
    }

    /** Applies an already validated overlay document. */
    public void apply(RegistryDocument doc) {
        checkMutable();
        sources.addAll(doc.sources);
        for (ObjectSpec spec : doc.objects) {
            register(spec);
        }
        for (OverrideRule rule : doc.overrides) {
            addOverride(rule);
        }
    }

    /** Makes the registry read-only. Idempotent. */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("Object registry is sealed");
        }
    }

    // --- Lookup ---

    /** Spec for a type name or alias, or null if unknown. */
    public ObjectSpec get(String type) {
        ObjectSpec spec = objects.get(type);
        if (spec != null) return spec;
        String canonical = aliases.get(type);
        return canonical != null ? objects.get(canonical) : null;
    }

    public boolean isKnown(String type) {
        return objects.containsKey(type) || aliases.containsKey(type);
    }

    /** Canonical key for an alias; the type itself otherwise. */
    public String canonicalKey(String type) {
        if (objects.containsKey(type)) return type;
        return aliases.getOrDefault(type, type);
    }

    /** Domain from the catalog, else signal for a {@code ~} suffix, else control. */
    public Domain getDomain(String type) {
        ObjectSpec spec = get(type);
        if (spec != null) return spec.domain;
        return type.endsWith("~") ? Domain.SIGNAL : Domain.CONTROL;
    }

    /**
     * Inlet and outlet count for one instance. Override rules are matched
     * against the canonical key, so aliases share their target's rule.
     */
    public IoCount getIoCount(String type, List<String> args) {
        ObjectSpec spec = get(type);
        IoCount defaults = spec != null
                ? new IoCount(spec.inlets.size(), spec.outlets.size())
                : IoCount.DEFAULT;
        OverrideRule rule = overrides.get(canonicalKey(type));
        if (rule != null) {
            return rule.apply(defaults, args != null ? args : List.of());
        }
        return defaults;
    }

    /** Symbol semantics for named-channel types, or null. */
    public ObjectSpec.SymbolSemantics getSymbolSemantics(String type) {
        ObjectSpec spec = get(type);
        return spec != null ? spec.symbolSemantics : null;
    }

    /**
     * Catalogued domain of one port, or null for unknown types and for ports
     * added by an override rule.
     */
    public Domain getPortDomain(String type, boolean inlet, int index) {
        ObjectSpec spec = get(type);
        if (spec == null) return null;
        List<ObjectSpec.IoletSpec> ports = inlet ? spec.inlets : spec.outlets;
        return index < ports.size() ? ports.get(index).toDomain() : null;
    }

    /** Port name from the catalog, or null. */
    public String getPortName(String type, boolean inlet, int index) {
        ObjectSpec spec = get(type);
        if (spec == null) return null;
        List<ObjectSpec.IoletSpec> ports = inlet ? spec.inlets : spec.outlets;
        return index < ports.size() ? ports.get(index).name : null;
    }

    public int size() {
        return objects.size();
    }

    // --- Export ---

    /** Snapshot of the registry in the overlay document format. */
    public RegistryDocument toExport() {
        RegistryDocument doc = new RegistryDocument();
        doc.registryVersion = RegistryDocument.REGISTRY_VERSION;
        doc.unknownObjectPolicy = RegistryDocument.POLICY_WARN;
        doc.sources = new ArrayList<>(sources);
        doc.objects = new ArrayList<>(objects.values());
        doc.overrides = new ArrayList<>(overrides.values());
        return doc;
    }
}
