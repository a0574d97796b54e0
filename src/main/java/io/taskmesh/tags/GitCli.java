package io.taskmesh.tags;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link VcsProbe} backed by the {@code git} executable. Any failure to run git is treated as
 * "not a repository".
 */
public final class GitCli implements VcsProbe {
    private static final Logger logger = LogManager.getLogger(GitCli.class);

    private final long timeoutMs;

    public GitCli() {
        this(5_000L);
    }

    public GitCli(long timeoutMs) {
        this.timeoutMs = Math.max(500L, timeoutMs);
    }

    @Override
    public boolean isRepository(Path projectRoot) {
        return run(projectRoot, List.of("git", "rev-parse", "--git-dir")).isPresent();
    }

    @Override
    public Optional<String> currentBranch(Path projectRoot) {
        return run(projectRoot, List.of("git", "rev-parse", "--abbrev-ref", "HEAD"))
                .filter(branch -> !branch.isBlank());
    }

    private Optional<String> run(Path workingDir, List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            logger.debug("git unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                logger.warn("git {} timed out after {} ms", command.subList(1, command.size()), timeoutMs);
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                logger.debug("git exit={} output={}", process.exitValue(), output);
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (IOException e) {
            process.destroyForcibly();
            logger.warn("git {} failed: {}", command.subList(1, command.size()), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
