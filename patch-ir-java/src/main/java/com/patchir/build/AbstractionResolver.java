package com.patchir.build;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Locates the patch file behind an abstraction name.
 */
@FunctionalInterface
public interface AbstractionResolver {

    /** Resolves nothing; every unknown type stays unresolved. */
    AbstractionResolver NONE = name -> Optional.empty();

    Optional<Path> resolve(String name);

    /**
     * Looks for {@code <dir>/<name>.pd} in each directory, first match wins.
     * Names with a path separator resolve relative to each directory.
     */
    static AbstractionResolver searchPaths(List<Path> directories) {
        return name -> {
            for (Path dir : directories) {
                Path candidate;
                try {
                    candidate = dir.resolve(name.replace('\\', '/') + ".pd");
                } catch (InvalidPathException e) {
                    // not a file name on this platform
                    return Optional.empty();
                }
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        };
    }
}
