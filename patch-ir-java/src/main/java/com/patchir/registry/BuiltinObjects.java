package com.patchir.registry;

import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.SymbolKind;
import com.patchir.registry.ObjectSpec.IoletSpec;
import com.patchir.registry.ObjectSpec.SymbolSemantics.Role;
import com.patchir.registry.OverrideRule.Formula;

/**
 * Built-in catalog of Pd vanilla objects.
 * A count of -1 marks a variable-arity port list; such types get one port
 * unless an override rule recomputes the count from the arguments.
 */
final class BuiltinObjects {

    static final String LIBRARY = "pd-vanilla";
    static final String LIBRARY_VERSION = "0.55";

    private BuiltinObjects() {}

    private record Row(String key, int inlets, int outlets, String... aliases) {}

    private static final Row[] CONTROL = {
            // Math
            new Row("float", 2, 1, "f"),
            new Row("int", 2, 1, "i"),
            new Row("+", 2, 1), new Row("-", 2, 1), new Row("*", 2, 1), new Row("/", 2, 1),
            new Row("pow", 2, 1), new Row("log", 2, 1),
            new Row("exp", 1, 1), new Row("abs", 1, 1), new Row("sqrt", 1, 1), new Row("wrap", 1, 1),
            new Row("mod", 2, 1, "%"), new Row("div", 2, 1),
            new Row("sin", 1, 1), new Row("cos", 1, 1), new Row("tan", 1, 1), new Row("atan", 1, 1),
            new Row("atan2", 2, 1), new Row("max", 2, 1), new Row("min", 2, 1),
            new Row("clip", 3, 1), new Row("random", 2, 1),
            // Comparison and logic
            new Row("==", 2, 1), new Row("!=", 2, 1), new Row(">", 2, 1), new Row("<", 2, 1),
            new Row(">=", 2, 1), new Row("<=", 2, 1),
            new Row("&&", 2, 1), new Row("||", 2, 1), new Row("!", 1, 1),
            // Flow
            new Row("bang", 1, 1, "b"),
            new Row("trigger", 1, -1, "t"),
            new Row("spigot", 2, 1),
            new Row("moses", 2, 2), new Row("until", 2, 2), new Row("swap", 2, 2),
            new Row("change", 1, 1),
            // Lists and routing
            new Row("pack", -1, 1),
            new Row("unpack", 1, -1),
            new Row("route", 1, -1),
            new Row("select", 1, -1, "sel"),
            new Row("list", 2, 1), new Row("append", 2, 1), new Row("prepend", 2, 1),
            // Time
            new Row("delay", 2, 1, "del"), new Row("metro", 2, 1), new Row("timer", 2, 1),
            new Row("pipe", -1, -1), new Row("line", 3, 1),
            // MIDI
            new Row("notein", 1, 3), new Row("noteout", 3, 0),
            new Row("ctlin", 1, 3), new Row("ctlout", 3, 0),
            new Row("bendin", 1, 2), new Row("bendout", 2, 0),
            new Row("pgmin", 1, 2), new Row("pgmout", 2, 0),
            new Row("touchin", 1, 2), new Row("touchout", 2, 0),
            new Row("polytouchin", 1, 3), new Row("polytouchout", 3, 0),
            new Row("midiin", 1, 2), new Row("midiout", 1, 0),
            new Row("makenote", 3, 2), new Row("stripnote", 2, 2),
            // Tables, files, misc
            new Row("tabread", 2, 1), new Row("tabwrite", 2, 0),
            new Row("soundfiler", 1, 2),
            new Row("loadbang", 0, 1),
            new Row("print", 1, 0),
            new Row("makefilename", 1, 1), new Row("openpanel", 1, 1), new Row("savepanel", 1, 1),
            new Row("expr", -1, -1),
    };

    private static final Row[] DSP = {
            // Oscillators
            new Row("osc~", 1, 1), new Row("phasor~", 1, 1), new Row("cos~", 1, 1), new Row("noise~", 0, 1),
            // Math
            new Row("+~", 2, 1), new Row("-~", 2, 1), new Row("*~", 2, 1), new Row("/~", 2, 1),
            new Row("max~", 2, 1), new Row("min~", 2, 1), new Row("clip~", 3, 1),
            new Row("wrap~", 1, 1), new Row("abs~", 1, 1), new Row("sqrt~", 1, 1), new Row("rsqrt~", 1, 1),
            new Row("pow~", 2, 1), new Row("log~", 2, 1), new Row("exp~", 1, 1),
            // Filters
            new Row("lop~", 2, 1), new Row("hip~", 2, 1), new Row("bp~", 3, 1), new Row("vcf~", 3, 2),
            new Row("biquad~", 6, 1),
            new Row("rpole~", 2, 1), new Row("rzero~", 2, 1), new Row("cpole~", 4, 2), new Row("czero~", 4, 2),
            // Delay
            new Row("delwrite~", 1, 0), new Row("delread~", 1, 1), new Row("delread4~", 1, 1), new Row("vd~", 1, 1),
            // Tables
            new Row("tabread~", 1, 1), new Row("tabread4~", 1, 1), new Row("tabosc4~", 1, 1),
            new Row("tabwrite~", 2, 0), new Row("tabplay~", 1, 2),
            new Row("tabsend~", 1, 0), new Row("tabreceive~", 0, 1),
            // Conversion and control
            new Row("sig~", 1, 1), new Row("line~", 1, 1), new Row("vline~", 1, 1),
            new Row("snapshot~", 2, 1), new Row("samplerate~", 0, 1),
            new Row("block~", 0, 0), new Row("switch~", 1, 0),
            // Analysis
            new Row("env~", 1, 1), new Row("threshold~", 5, 2), new Row("bonk~", 1, 2),
            new Row("fiddle~", 1, 4), new Row("sigmund~", 1, -1),
            // Audio I/O
            new Row("adc~", 0, -1), new Row("dac~", -1, 0),
            new Row("readsf~", 1, -1), new Row("writesf~", -1, 0),
    };

    private static final Row[] GUI = {
            new Row("bng", 1, 1), new Row("tgl", 1, 1), new Row("nbx", 1, 1),
            new Row("hsl", 1, 1), new Row("vsl", 1, 1),
            new Row("hradio", 1, 1), new Row("vradio", 1, 1),
            new Row("vu", 2, 2), new Row("cnv", 0, 0),
            new Row("floatatom", 1, 1), new Row("symbolatom", 1, 1), new Row("listbox", 1, 1),
    };

    static void registerAll(ObjectRegistry registry) {
        for (Row row : CONTROL) {
            registry.register(fromRow(row, ObjectSpec.KIND_CONTROL, Domain.CONTROL));
        }
        for (Row row : DSP) {
            registry.register(fromRow(row, ObjectSpec.KIND_DSP, Domain.SIGNAL));
        }
        for (Row row : GUI) {
            registry.register(fromRow(row, ObjectSpec.KIND_GUI, Domain.CONTROL));
        }
        registerNamedChannels(registry);
        registerInterfaceMarkers(registry);
        registerOverrides(registry);
    }

    private static ObjectSpec fromRow(Row row, String kind, Domain domain) {
        ObjectSpec spec = ObjectSpec.of(row.key(), LIBRARY, kind, domain).aliases(row.aliases());
        boolean dsp = domain == Domain.SIGNAL;
        int inlets = row.inlets() == -1 ? 1 : row.inlets();
        int outlets = row.outlets() == -1 ? 1 : row.outlets();
        for (int i = 0; i < inlets; i++) {
            String portDomain = !dsp ? IoletSpec.CONTROL : (i == 0 ? IoletSpec.SIGNAL_OR_CONTROL : IoletSpec.SIGNAL);
            spec.inlet(portDomain, null);
        }
        for (int i = 0; i < outlets; i++) {
            spec.outlet(dsp ? IoletSpec.SIGNAL : IoletSpec.CONTROL, null);
        }
        return spec;
    }

    private static void registerNamedChannels(ObjectRegistry registry) {
        registry.register(ObjectSpec.of("send", LIBRARY, ObjectSpec.KIND_CONTROL, Domain.CONTROL)
                .inlet(IoletSpec.CONTROL, "in").symbolArg().aliases("s")
                .semantics(SymbolKind.SEND_RECEIVE, Role.WRITER));
        registry.register(ObjectSpec.of("receive", LIBRARY, ObjectSpec.KIND_CONTROL, Domain.CONTROL)
                .outlet(IoletSpec.CONTROL, "out").symbolArg().aliases("r")
                .semantics(SymbolKind.SEND_RECEIVE, Role.READER));
        registry.register(ObjectSpec.of("send~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .inlet(IoletSpec.SIGNAL, "in").symbolArg().aliases("s~")
                .semantics(SymbolKind.SEND_RECEIVE, Role.WRITER));
        registry.register(ObjectSpec.of("receive~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .outlet(IoletSpec.SIGNAL, "out").symbolArg().aliases("r~")
                .semantics(SymbolKind.SEND_RECEIVE, Role.READER));
        registry.register(ObjectSpec.of("throw~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .inlet(IoletSpec.SIGNAL, "in").symbolArg()
                .semantics(SymbolKind.THROW_CATCH, Role.WRITER));
        registry.register(ObjectSpec.of("catch~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .outlet(IoletSpec.SIGNAL, "out").symbolArg()
                .semantics(SymbolKind.THROW_CATCH, Role.READER));
        registry.register(ObjectSpec.of("value", LIBRARY, ObjectSpec.KIND_CONTROL, Domain.CONTROL)
                .inlet(IoletSpec.CONTROL, null).outlet(IoletSpec.CONTROL, null).symbolArg().aliases("v")
                .semantics(SymbolKind.VALUE, Role.READER));
    }

    private static void registerInterfaceMarkers(ObjectRegistry registry) {
        registry.register(ObjectSpec.of("inlet", LIBRARY, ObjectSpec.KIND_CONTROL, Domain.CONTROL)
                .outlet(IoletSpec.CONTROL, null));
        registry.register(ObjectSpec.of("outlet", LIBRARY, ObjectSpec.KIND_CONTROL, Domain.CONTROL)
                .inlet(IoletSpec.CONTROL, null));
        registry.register(ObjectSpec.of("inlet~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .outlet(IoletSpec.SIGNAL, null));
        registry.register(ObjectSpec.of("outlet~", LIBRARY, ObjectSpec.KIND_DSP, Domain.SIGNAL)
                .inlet(IoletSpec.SIGNAL, null));
    }

    private static void registerOverrides(ObjectRegistry registry) {
        registry.addOverride(OverrideRule.of("route", Formula.OUTLETS_ONE_PLUS_ARGC));
        registry.addOverride(OverrideRule.of("select", Formula.OUTLETS_ONE_PLUS_ARGC));
        registry.addOverride(OverrideRule.of("unpack", Formula.OUTLETS_ARGC));
        registry.addOverride(OverrideRule.of("pack", Formula.INLETS_ARGC));
        registry.addOverride(OverrideRule.of("trigger", Formula.OUTLETS_ARGC));
        registry.addOverride(OverrideRule.of("dac~", Formula.INLETS_MAX_ARGC_TWO));
        registry.addOverride(OverrideRule.of("adc~", Formula.OUTLETS_MAX_ARGC_TWO));
        // channels plus the done bang
        registry.addOverride(OverrideRule.of("readsf~", Formula.OUTLETS_ARG0_PLUS_ONE));
        registry.addOverride(OverrideRule.of("writesf~", Formula.INLETS_ARG0));
    }
}
