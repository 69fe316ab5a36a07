package com.patchir.source;

import com.google.gson.annotations.SerializedName;

/**
 * Closed tag set for elements of a parsed patch.
 */
public enum SourceKind {
    @SerializedName("object")  OBJECT,
    @SerializedName("message") MESSAGE,
    @SerializedName("atom")    ATOM,
    @SerializedName("gui")     GUI,
    @SerializedName("comment") COMMENT,
    @SerializedName("canvas")  CANVAS
}
