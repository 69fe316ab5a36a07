package com.patchir.source;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * One drawing surface. Object ids are the element's position in {@code objects}
 * as the patch file numbers them, and edges refer to those ids.
 */
public class SourceCanvas {

    @SerializedName("name")    public String name;
    @SerializedName("objects") public List<SourceObject> objects = new ArrayList<>();
    @SerializedName("edges")   public List<SourceEdge> edges = new ArrayList<>();

    public static SourceCanvas named(String name) {
        SourceCanvas canvas = new SourceCanvas();
        canvas.name = name;
        return canvas;
    }

    /** Appends an element, numbering it by its position. */
    public SourceCanvas add(SourceObject object) {
        object.id = objects.size();
        objects.add(object);
        return this;
    }

    public SourceCanvas connect(int source, int sourcePort, int sink, int sinkPort) {
        edges.add(SourceEdge.of(source, sourcePort, sink, sinkPort));
        return this;
    }
}
