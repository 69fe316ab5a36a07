package com.patchir.source;

import com.google.gson.annotations.SerializedName;

/**
 * Parsed patch: a name, the path of the patch file it was parsed from, and the root canvas.
 */
public class SourcePatch {

    @SerializedName("name") public String name;
    @SerializedName("path") public String path;   // nullable
    @SerializedName("root") public SourceCanvas root;

    public static SourcePatch of(String name, SourceCanvas root) {
        SourcePatch patch = new SourcePatch();
        patch.name = name;
        patch.root = root;
        return patch;
    }
}
