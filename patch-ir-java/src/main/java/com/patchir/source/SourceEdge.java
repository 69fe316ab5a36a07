package com.patchir.source;

import com.google.gson.annotations.SerializedName;

/**
 * Wire between two elements of the same canvas, by object id and port index.
 */
public class SourceEdge {

    @SerializedName("source")      public int source;
    @SerializedName("source_port") public int sourcePort;
    @SerializedName("sink")        public int sink;
    @SerializedName("sink_port")   public int sinkPort;

    public static SourceEdge of(int source, int sourcePort, int sink, int sinkPort) {
        SourceEdge e = new SourceEdge();
        e.source = source;
        e.sourcePort = sourcePort;
        e.sink = sink;
        e.sinkPort = sinkPort;
        return e;
    }
}
