package com.patchir.registry;

import com.google.gson.annotations.SerializedName;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.SymbolKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Specification of one known object type: its ports, arguments, aliases and,
 * for named-channel objects, its symbol semantics.
 * Also the element type of the "objects" array in registry overlay files.
 */
public class ObjectSpec {

    public static final String KIND_CONTROL = "control";
    public static final String KIND_DSP = "dsp";
    public static final String KIND_GUI = "gui";

    @SerializedName("key")              public String key;
    @SerializedName("library")          public String library;
    @SerializedName("kind")             public String kind;      // dsp, control, gui
    @SerializedName("domain")           public Domain domain;
    @SerializedName("inlets")           public List<IoletSpec> inlets = new ArrayList<>();
    @SerializedName("outlets")          public List<IoletSpec> outlets = new ArrayList<>();
    @SerializedName("args")             public List<ArgSpec> args = new ArrayList<>();
    @SerializedName("aliases")          public List<String> aliases = new ArrayList<>();
    @SerializedName("symbol_semantics") public SymbolSemantics symbolSemantics;  // nullable

    public static ObjectSpec of(String key, String library, String kind, Domain domain) {
        ObjectSpec spec = new ObjectSpec();
        spec.key = key;
        spec.library = library;
        spec.kind = kind;
        spec.domain = domain;
        return spec;
    }

    public ObjectSpec inlet(String domain, String name) {
        inlets.add(IoletSpec.of(domain, name));
        return this;
    }

    public ObjectSpec outlet(String domain, String name) {
        outlets.add(IoletSpec.of(domain, name));
        return this;
    }

    public ObjectSpec symbolArg() {
        ArgSpec arg = new ArgSpec();
        arg.name = "symbol";
        arg.type = "symbol";
        arg.required = true;
        args.add(arg);
        return this;
    }

    public ObjectSpec aliases(String... names) {
        aliases.addAll(List.of(names));
        return this;
    }

    public ObjectSpec semantics(SymbolKind kind, SymbolSemantics.Role role) {
        symbolSemantics = SymbolSemantics.of(kind, role);
        return this;
    }

    /** Port specification; domain is one of "signal", "control", "signal_or_control". */
    public static class IoletSpec {
        public static final String SIGNAL = "signal";
        public static final String CONTROL = "control";
        public static final String SIGNAL_OR_CONTROL = "signal_or_control";

        @SerializedName("domain") public String domain = CONTROL;
        @SerializedName("name")   public String name;

        public static IoletSpec of(String domain, String name) {
            IoletSpec spec = new IoletSpec();
            spec.domain = domain;
            spec.name = name;
            return spec;
        }

        public Domain toDomain() {
            if (SIGNAL.equals(domain)) return Domain.SIGNAL;
            if (SIGNAL_OR_CONTROL.equals(domain)) return Domain.MIXED;
            return Domain.CONTROL;
        }
    }

    public static class ArgSpec {
        @SerializedName("name")     public String name;
        @SerializedName("type")     public String type;     // number, symbol, list, any
        @SerializedName("required") public boolean required;
        @SerializedName("default")  public String defaultValue;
    }

    public static class SymbolSemantics {

        public enum Role {
            @SerializedName("writer") WRITER("writer"),
            @SerializedName("reader") READER("reader");

            private final String tag;
            Role(String tag) { this.tag = tag; }
            public String tag() { return tag; }
        }

        @SerializedName("kind") public SymbolKind kind;
        @SerializedName("role") public Role role;

        public static SymbolSemantics of(SymbolKind kind, Role role) {
            SymbolSemantics s = new SymbolSemantics();
            s.kind = kind;
            s.role = role;
            return s;
        }
    }
}
