package com.patchir.registry;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of a registry: the overlay files accepted by {@link ObjectRegistry#loadJson}
 * and the export produced by {@link ObjectRegistry#toExport()}.
 */
public class RegistryDocument {

    public static final String REGISTRY_VERSION = "0.1";
    public static final String POLICY_WARN = "warn";

    @SerializedName("registry_version")      public String registryVersion;
    @SerializedName("unknown_object_policy") public String unknownObjectPolicy;
    @SerializedName("sources")               public List<Source> sources = new ArrayList<>();
    @SerializedName("objects")               public List<ObjectSpec> objects = new ArrayList<>();
    @SerializedName("overrides")             public List<OverrideRule> overrides = new ArrayList<>();

    public static class Source {
        @SerializedName("name")    public String name;
        @SerializedName("version") public String version;

        public static Source of(String name, String version) {
            Source s = new Source();
            s.name = name;
            s.version = version;
            return s;
        }
    }
}
