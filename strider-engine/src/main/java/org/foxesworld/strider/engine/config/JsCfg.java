package org.foxesworld.strider.engine.config;

import com.jme3.math.Vector3f;
import org.graalvm.polyglot.Value;

/**
 * Lenient readers over polyglot values: a missing, null or mistyped member yields the default.
 */
public final class JsCfg {
    private JsCfg() {}

    // ---------- Basic ----------

    public static boolean has(Value v) {
        return v != null && !v.isNull();
    }

    public static Value member(Value v, String key) {
        return (has(v) && v.hasMember(key)) ? v.getMember(key) : null;
    }

    public static String str(Value cfg, String key, String def) {
        Value m = member(cfg, key);
        if (m == null || m.isNull() || !m.isString()) return def;
        return m.asString();
    }

    public static boolean bool(Value cfg, String key, boolean def) {
        Value m = member(cfg, key);
        if (m == null || m.isNull() || !m.isBoolean()) return def;
        return m.asBoolean();
    }

    public static double num(Value cfg, String key, double def) {
        Value m = member(cfg, key);
        if (m == null || m.isNull() || !m.fitsInDouble()) return def;
        return m.asDouble();
    }

    public static float numClamp(Value cfg, String key, float def, float lo, float hi) {
        return (float) clamp(num(cfg, key, def), lo, hi);
    }

    public static int intR(Value cfg, String key, int def) {
        return (int) Math.round(num(cfg, key, def));
    }

    // ---------- Vec3 ----------
    // accepts [x,y,z] or {x,y,z}

    /** Writes into {@code target} when {@code v} is a usable vector; returns whether it did. */
    public static boolean vec3(Value v, Vector3f target) {
        if (!has(v)) return false;
        if (v.hasArrayElements() && v.getArraySize() >= 3) {
            Value x = v.getArrayElement(0), y = v.getArrayElement(1), z = v.getArrayElement(2);
            if (!x.fitsInDouble() || !y.fitsInDouble() || !z.fitsInDouble()) return false;
            target.set((float) x.asDouble(), (float) y.asDouble(), (float) z.asDouble());
            return true;
        }
        if (v.hasMember("x") && v.hasMember("y") && v.hasMember("z")) {
            target.set((float) num(v, "x", target.x), (float) num(v, "y", target.y), (float) num(v, "z", target.z));
            return true;
        }
        return false;
    }

    // ---------- Clamp ----------
    public static int clamp(int v, int lo, int hi) { return Math.max(lo, Math.min(hi, v)); }
    public static double clamp(double v, double lo, double hi) { return Math.max(lo, Math.min(hi, v)); }
}
