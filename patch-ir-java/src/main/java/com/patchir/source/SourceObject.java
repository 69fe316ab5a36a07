package com.patchir.source;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One element of a canvas. {@code className} and {@code args} are set for
 * objects, atoms and GUI widgets; messages and comments carry {@code text};
 * sub-patches carry {@code canvas}.
 */
public class SourceObject {

    @SerializedName("id")         public int id;
    @SerializedName("kind")       public SourceKind kind;
    @SerializedName("class_name") public String className;
    @SerializedName("args")       public List<String> args = new ArrayList<>();
    @SerializedName("text")       public String text;
    @SerializedName("position")   public Position position;
    @SerializedName("canvas")     public SourceCanvas canvas;

    public static class Position {
        @SerializedName("x") public int x;
        @SerializedName("y") public int y;

        public static Position at(int x, int y) {
            Position p = new Position();
            p.x = x;
            p.y = y;
            return p;
        }
    }

    public static SourceObject object(String className, String... args) {
        SourceObject o = new SourceObject();
        o.kind = SourceKind.OBJECT;
        o.className = className;
        o.args = new ArrayList<>(Arrays.asList(args));
        return o;
    }

    public static SourceObject message(String text) {
        SourceObject o = new SourceObject();
        o.kind = SourceKind.MESSAGE;
        o.text = text;
        return o;
    }

    public static SourceObject comment(String text) {
        SourceObject o = new SourceObject();
        o.kind = SourceKind.COMMENT;
        o.text = text;
        return o;
    }

    public static SourceObject subpatch(SourceCanvas canvas) {
        SourceObject o = new SourceObject();
        o.kind = SourceKind.CANVAS;
        o.canvas = canvas;
        return o;
    }

    public SourceObject at(int x, int y) {
        position = Position.at(x, y);
        return this;
    }
}
