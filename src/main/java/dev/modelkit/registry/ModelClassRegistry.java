package dev.modelkit.registry;

import dev.modelkit.config.ModelKitConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Looks up model classes by name within a fixed set of exported classes.
 *
 * <p>The exported set is given explicitly or read from classpath resources that list one fully
 * qualified class name per line ({@code #} starts a comment). Only public classes are exported.
 */
@Slf4j
public final class ModelClassRegistry {
    private final List<Class<?>> exported;

    private ModelClassRegistry(Collection<Class<?>> exported) {
        this.exported =
                exported.stream().filter(c -> Modifier.isPublic(c.getModifiers())).toList();
    }

    public static ModelClassRegistry of(Class<?>... exported) {
        return new ModelClassRegistry(List.of(exported));
    }

    public static ModelClassRegistry of(Collection<Class<?>> exported) {
        return new ModelClassRegistry(exported);
    }

    /** The registry listed by the configured resource on the context class loader. */
    public static ModelClassRegistry fromConfig(ModelKitConfig config) {
        var loader = Thread.currentThread().getContextClassLoader();
        return fromResource(
                config.modelRegistryResource(),
                loader != null ? loader : ModelClassRegistry.class.getClassLoader());
    }

    /**
     * Reads every copy of {@code resource} visible to {@code loader}. Names that cannot be loaded
     * are logged and skipped.
     */
    public static ModelClassRegistry fromResource(
            @Nonnull String resource, @Nonnull ClassLoader loader) {
        Set<Class<?>> classes = new LinkedHashSet<>();
        for (String className : listedClassNames(resource, loader)) {
            try {
                classes.add(Class.forName(className, false, loader));
            } catch (ClassNotFoundException | LinkageError e) {
                log.warn("skipping unloadable model class {}: {}", className, e.toString());
            }
        }
        return new ModelClassRegistry(classes);
    }

    private static List<String> listedClassNames(String resource, ClassLoader loader) {
        List<String> names = new ArrayList<>();
        try {
            Enumeration<URL> urls = loader.getResources(resource);
            for (URL url : Collections.list(urls)) {
                try (InputStream in = url.openStream();
                        var reader =
                                new BufferedReader(
                                        new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    reader.lines()
                            .map(line -> line.replaceFirst("#.*", "").trim())
                            .filter(line -> !line.isEmpty())
                            .forEach(names::add);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read model registry " + resource, e);
        }
        return names;
    }

    /**
     * Finds the exported class whose simple name is exactly {@code modelName}.
     *
     * @return the class, or empty when no exported class has that name
     */
    public Optional<Class<?>> find(String modelName) {
        for (Class<?> candidate : exported) {
            if (candidate.getSimpleName().equals(modelName)) {
                return Optional.of(candidate);
            }
        }
        log.debug("can not find model class <{}>", modelName);
        return Optional.empty();
    }

    public List<Class<?>> exported() {
        return exported;
    }
}
