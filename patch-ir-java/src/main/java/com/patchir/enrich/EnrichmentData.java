package com.patchir.enrich;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a {@code <name>.enrichment.json} sidecar: human or model
 * supplied annotations pinned to the graph hash they were written against.
 */
public class EnrichmentData {

    public static final String SCHEMA = "pd-enrichment-0.1";

    @SerializedName("schema")           public String schema = SCHEMA;
    @SerializedName("patch")            public String patch = "";
    @SerializedName("based_on_ir_sha")  public String basedOnIrSha;
    @SerializedName("generated_at")     public String generatedAt;
    @SerializedName("generator")        public String generator;
    @SerializedName("summary")          public String summary;
    @SerializedName("roles")            public List<String> roles = new ArrayList<>();
    @SerializedName("node_roles")       public Map<String, List<String>> nodeRoles = new LinkedHashMap<>();
    @SerializedName("inlet_semantics")  public Map<String, String> inletSemantics = new LinkedHashMap<>();
    @SerializedName("outlet_semantics") public Map<String, String> outletSemantics = new LinkedHashMap<>();
    @SerializedName("notes")            public List<String> notes = new ArrayList<>();

    /** Replaces fields a hand-edited file left out or set to null. */
    EnrichmentData normalized() {
        if (schema == null) schema = SCHEMA;
        if (patch == null) patch = "";
        if (roles == null) roles = new ArrayList<>();
        if (nodeRoles == null) nodeRoles = new LinkedHashMap<>();
        if (inletSemantics == null) inletSemantics = new LinkedHashMap<>();
        if (outletSemantics == null) outletSemantics = new LinkedHashMap<>();
        if (notes == null) notes = new ArrayList<>();
        return this;
    }
}
