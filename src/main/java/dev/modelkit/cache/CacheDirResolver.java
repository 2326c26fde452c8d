package dev.modelkit.cache;

import dev.modelkit.config.ModelKitConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Decides where the files of a pretrained model are cached.
 *
 * <p>Precedence: an existing local directory is used as is; otherwise an explicit cache dir wins
 * over the default home of the source (the model hub cache, or the local model home).
 */
public final class CacheDirResolver {
    private final Path modelHome;
    private final Path hfCacheHome;
    private final Predicate<Path> isDirectory;

    public CacheDirResolver(ModelKitConfig config) {
        this(Path.of(config.modelHome()), Path.of(config.hfCacheHome()), Files::isDirectory);
    }

    public CacheDirResolver(Path modelHome, Path hfCacheHome, Predicate<Path> isDirectory) {
        this.modelHome = Objects.requireNonNull(modelHome);
        this.hfCacheHome = Objects.requireNonNull(hfCacheHome);
        this.isDirectory = Objects.requireNonNull(isDirectory);
    }

    /**
     * @param nameOrPath a model name or a local directory holding the model
     * @param fromHfHub whether the model comes from the hub, whose client appends the model name
     *     itself
     * @param cacheDir explicit cache dir, or null for the default
     */
    public Path resolve(@Nonnull String nameOrPath, boolean fromHfHub, @Nullable String cacheDir) {
        Path local = Path.of(nameOrPath);
        if (isDirectory.test(local)) {
            return local;
        }
        if (fromHfHub) {
            return cacheDir != null ? Path.of(cacheDir) : hfCacheHome;
        }
        if (cacheDir != null) {
            // loading a model loads its config through the same path, so the name may already be
            // appended
            if (cacheDir.endsWith(nameOrPath)) {
                return Path.of(cacheDir);
            }
            return Path.of(cacheDir, nameOrPath);
        }
        return modelHome.resolve(nameOrPath);
    }
}
