package org.foxesworld.strider.engine.input;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.jme3.input.KeyInput;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Held-key table fed by raw key events. Key names ("C", "SPACE", "LSHIFT", "ESC") resolve
 * through the {@code KEY_*} constants of {@link KeyInput}.
 */
public final class KeyboardState {

    private static final int KEY_MAX = 256;

    private static final LoadingCache<String, Integer> KEY_CODE_CACHE =
            Caffeine.newBuilder()
                    .maximumSize(256)
                    .expireAfterAccess(Duration.ofMinutes(10))
                    .build(KeyboardState::resolveKeyCode);

    private final boolean[] down = new boolean[KEY_MAX];

    public void onKeyEvent(int keyCode, boolean pressed) {
        if (keyCode >= 0 && keyCode < down.length) {
            down[keyCode] = pressed;
        }
    }

    public boolean keyDown(int keyCode) {
        return keyCode >= 0 && keyCode < down.length && down[keyCode];
    }

    public boolean keyDown(String name) {
        return keyDown(keyCode(name));
    }

    public void releaseAll() {
        Arrays.fill(down, false);
    }

    /** Code for a key name, or -1 when the name is unknown. */
    public static int keyCode(String name) {
        if (name == null) return -1;
        return KEY_CODE_CACHE.get(name);
    }

    private static int resolveKeyCode(String raw) {
        String key = raw.trim().toUpperCase(Locale.ROOT);
        if (key.isEmpty()) return -1;
        Integer v = KeyNames.MAP.get(key);
        return v != null ? v : -1;
    }

    private static final class KeyNames {
        private static final Map<String, Integer> MAP = build();

        private static Map<String, Integer> build() {
            HashMap<String, Integer> m = new HashMap<>(256);

            for (Field f : KeyInput.class.getFields()) {
                int mod = f.getModifiers();
                if (!Modifier.isStatic(mod) || f.getType() != int.class) continue;

                String n = f.getName();
                if (!n.startsWith("KEY_")) continue;

                try {
                    m.put(n.substring(4), f.getInt(null));
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("KeyInput." + n + " not readable", e);
                }
            }

            alias(m, "ESC", "ESCAPE");
            alias(m, "ENTER", "RETURN");
            alias(m, "CTRL", "LCONTROL");
            alias(m, "LCTRL", "LCONTROL");
            alias(m, "RCTRL", "RCONTROL");
            alias(m, "SHIFT", "LSHIFT");
            alias(m, "ALT", "LMENU");
            alias(m, "LALT", "LMENU");
            alias(m, "RALT", "RMENU");

            return Collections.unmodifiableMap(m);
        }

        private static void alias(HashMap<String, Integer> m, String a, String b) {
            Integer v = m.get(b);
            if (v != null) m.put(a, v);
        }
    }
}
