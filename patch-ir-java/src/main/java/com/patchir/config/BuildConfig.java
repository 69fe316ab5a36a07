package com.patchir.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of build-config.json. Every field is optional; command-line
 * flags take precedence over what is set here.
 */
public class BuildConfig {

    public static final String DEFAULT_OUTPUT_DIR = "ir-out";
    public static final int DEFAULT_MAX_TRACE_DEPTH = 100;

    /** Registry overlay documents applied on top of the built-in catalogue, in order. */
    @SerializedName("registry_files")
    private List<String> registryFiles;

    /** Directories searched for {@code <name>.pd} abstractions. */
    @SerializedName("abstraction_paths")
    private List<String> abstractionPaths;

    @SerializedName("output_dir")
    private String outputDir;

    /** Where enrichment sidecars are kept (default: next to each patch). */
    @SerializedName("enrichment_dir")
    private String enrichmentDir;

    @SerializedName("max_trace_depth")
    private Integer maxTraceDepth;

    @SerializedName("include_symbol_edges")
    private Boolean includeSymbolEdges;

    public List<String> getRegistryFiles()    { return registryFiles    != null ? registryFiles    : Collections.emptyList(); }
    public List<String> getAbstractionPaths() { return abstractionPaths != null ? abstractionPaths : Collections.emptyList(); }
    public String getOutputDir()              { return outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR; }
    public String getEnrichmentDir()          { return enrichmentDir; }
    public int getMaxTraceDepth()             { return maxTraceDepth != null && maxTraceDepth > 0 ? maxTraceDepth : DEFAULT_MAX_TRACE_DEPTH; }
    public boolean isIncludeSymbolEdges()     { return includeSymbolEdges == null || includeSymbolEdges; }
}
