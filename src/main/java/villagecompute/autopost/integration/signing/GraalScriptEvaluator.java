package villagecompute.autopost.integration.signing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.jboss.logging.Logger;

import villagecompute.autopost.exceptions.SigningException;

/**
 * GraalJS-backed {@link ScriptEvaluator}.
 *
 * <p>
 * The engine and parsed sources are shared; each call gets its own {@link Context}, so calls never observe each
 * other's globals and may run concurrently. Sources are loaded lazily on first use and dropped by {@link #reload()}.
 */
public class GraalScriptEvaluator implements ScriptEvaluator {

    private static final Logger LOG = Logger.getLogger(GraalScriptEvaluator.class);

    private static final String LANGUAGE = "js";
    private static final String PRELUDE = "var window = globalThis; var self = globalThis;";

    private final List<Path> scriptPaths;
    private final Object lifecycleLock = new Object();

    private Engine engine;
    private List<Source> sources;

    public GraalScriptEvaluator(List<Path> scriptPaths) {
        this.scriptPaths = List.copyOf(scriptPaths);
    }

    @Override
    public String call(String function, List<String> jsonArgs) {
        Loaded loaded = ensureLoaded();
        try (Context context = Context.newBuilder(LANGUAGE).engine(loaded.engine()).allowAllAccess(false).build()) {
            for (Source source : loaded.sources()) {
                context.eval(source);
            }
            context.getBindings(LANGUAGE).putMember("__signArgs", "[" + String.join(",", jsonArgs) + "]");
            Value result = context.eval(LANGUAGE,
                    "JSON.stringify(" + function + ".apply(null, JSON.parse(__signArgs)))");
            if (result.isNull()) {
                throw new SigningException(function + " returned undefined");
            }
            return result.asString();
        } catch (PolyglotException e) {
            throw new SigningException("Script call " + function + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void reload() {
        synchronized (lifecycleLock) {
            LOG.info("Reloading signing scripts");
            closeEngine();
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            closeEngine();
        }
    }

    private Loaded ensureLoaded() {
        synchronized (lifecycleLock) {
            if (engine == null) {
                Engine newEngine = Engine.newBuilder(LANGUAGE).option("engine.WarnInterpreterOnly", "false").build();
                List<Source> loaded = new ArrayList<>();
                loaded.add(Source.create(LANGUAGE, PRELUDE));
                for (Path path : scriptPaths) {
                    try {
                        loaded.add(Source.newBuilder(LANGUAGE, Files.readString(path), path.getFileName().toString())
                                .cached(true).build());
                    } catch (IOException e) {
                        newEngine.close();
                        throw new SigningException("Cannot read signing script " + path, e);
                    }
                }
                sources = List.copyOf(loaded);
                engine = newEngine;
                LOG.infof("Loaded %d signing script(s)", scriptPaths.size());
            }
            return new Loaded(engine, sources);
        }
    }

    private void closeEngine() {
        if (engine != null) {
            Engine old = engine;
            engine = null;
            sources = null;
            try {
                old.close();
            } catch (IllegalStateException e) {
                // in-flight calls keep the old engine alive until they finish
                LOG.warnf("Signing engine still in use, leaving it to in-flight calls: %s", e.getMessage());
            }
        }
    }

    private record Loaded(Engine engine, List<Source> sources) {
    }
}
