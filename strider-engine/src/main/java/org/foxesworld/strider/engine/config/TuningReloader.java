package org.foxesworld.strider.engine.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Loads the player tuning file ({@code player.js} or {@code player.json}) and re-applies it
 * whenever it changes on disk. A broken file is logged and the previous tuning stays in effect.
 */
public final class TuningReloader implements Closeable {

    private static final Logger log = LogManager.getLogger(TuningReloader.class);

    public static final String DIR_PROPERTY = "strider.tuning.dir";

    private static final float COOLDOWN_SEC = 0.25f;

    private final Path file;
    private final PlayerConfig config;
    private final PlayerConfigBinder binder;
    private HotReloadWatcher watcher;

    private float cooldown;
    private boolean pending;

    public TuningReloader(Path file, PlayerConfig config) {
        this(file, config, new PlayerConfigBinder());
    }

    public TuningReloader(Path file, PlayerConfig config, PlayerConfigBinder binder) {
        this.file = file.toAbsolutePath().normalize();
        this.config = config;
        this.binder = binder;
    }

    /** Resolves the tuning file from {@value #DIR_PROPERTY}; {@code null} when unset or missing. */
    public static TuningReloader fromSystemProperty(PlayerConfig config) {
        String dir = System.getProperty(DIR_PROPERTY);
        if (dir == null || dir.isBlank()) return null;
        for (String name : new String[]{"player.js", "player.json"}) {
            Path p = Path.of(dir, name);
            if (Files.isRegularFile(p)) return new TuningReloader(p, config);
        }
        log.warn("[tuning] no player.js or player.json in {}", dir);
        return null;
    }

    public Path file() {
        return file;
    }

    /** Applies the file once and starts watching its directory. */
    public boolean start() {
        boolean ok = reload();
        Path dir = file.getParent();
        if (dir != null && watcher == null) {
            watcher = new HotReloadWatcher(dir, Set.of(".js", ".json"));
        }
        return ok;
    }

    public void update(float tpf) {
        if (watcher == null) return;
        if (watcher.pollChanged().contains(file.getFileName().toString())) {
            pending = true;
            cooldown = COOLDOWN_SEC;
        }
        if (!pending) return;
        cooldown -= tpf;
        if (cooldown > 0f) return;
        pending = false;
        reload();
    }

    public boolean reload() {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[tuning] failed to read {}", file, e);
            return false;
        }
        boolean json = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        return apply(text, file.getFileName().toString(), json);
    }

    /**
     * Evaluates {@code text} as a JS expression (JSON wrapped in parentheses) and binds it.
     * Returns false and leaves the config untouched when evaluation fails.
     */
    public boolean apply(String text, String name, boolean json) {
        String code = json ? "(" + text + "\n)" : text;
        try (Context ctx = Context.newBuilder("js")
                .allowAllAccess(false)
                .option("engine.WarnInterpreterOnly", "false")
                .build()) {
            Value v = ctx.eval(Source.newBuilder("js", code, name).buildLiteral());
            if (v == null || v.isNull() || !v.hasMembers()) {
                log.warn("[tuning] {} did not evaluate to an object, ignored", name);
                return false;
            }
            binder.apply(v, config);
            log.info("[tuning] applied {}", name);
            return true;
        } catch (PolyglotException e) {
            log.error("[tuning] {} failed: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
    }
}
