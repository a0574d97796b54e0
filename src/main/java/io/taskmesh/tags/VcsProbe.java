package io.taskmesh.tags;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Read-only view of the version control checkout a project lives in.
 */
public interface VcsProbe {
    boolean isRepository(Path projectRoot);

    Optional<String> currentBranch(Path projectRoot);

    VcsProbe NONE = new VcsProbe() {
        @Override
        public boolean isRepository(Path projectRoot) {
            return false;
        }

        @Override
        public Optional<String> currentBranch(Path projectRoot) {
            return Optional.empty();
        }
    };
}
