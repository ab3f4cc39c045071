package com.trendearly.pipeline.publisher;

import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.exception.PublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.nio.file.attribute.UserPrincipalLookupService;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Swaps a fully built staged tree into the live directory.
 *
 * <ol>
 *   <li>fix permissions/ownership on the staged tree</li>
 *   <li>rename {@code live} to {@code live.prev}</li>
 *   <li>rename {@code staged} to {@code live}; on failure rename {@code live.prev} back</li>
 *   <li>delete {@code live.prev}</li>
 * </ol>
 *
 * Readers see either the old tree or the new one, never a mix.
 */
@Slf4j
@Component
public class AtomicPublisher {

    private static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwxr-xr-x");
    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final DirectoryMover mover;
    private final String owner;
    private final String group;

    public AtomicPublisher(DirectoryMover mover, PipelineProperties properties) {
        this.mover = mover;
        this.owner = properties.getSite().getOwner();
        this.group = properties.getSite().getGroup();
    }

    public void publish(Path stagedDir, Path liveDir) throws PublishException {
        if (!Files.isDirectory(stagedDir)) {
            throw new PublishException("Staged directory does not exist: " + stagedDir);
        }

        fixUpStagedTree(stagedDir);

        Path previous = previousDir(liveDir);
        removeLeftover(previous);

        boolean hadLive = Files.exists(liveDir);
        if (hadLive) {
            try {
                mover.move(liveDir, previous);
            } catch (IOException e) {
                throw new PublishException("Failed to move live tree aside: " + liveDir, e);
            }
        }

        try {
            mover.move(stagedDir, liveDir);
        } catch (IOException e) {
            PublishException failure = new PublishException("Failed to swap staged tree into " + liveDir, e);
            if (hadLive) {
                restore(previous, liveDir, failure);
            }
            throw failure;
        }

        if (hadLive) {
            try {
                FileSystemUtils.deleteRecursively(previous);
            } catch (IOException e) {
                // swap 자체는 성공
                log.warn("[Publish] failed to delete previous tree {}: {}", previous, e.getMessage());
            }
        }
        log.info("[Publish] published {} -> {}", stagedDir, liveDir);
    }

    public static Path previousDir(Path liveDir) {
        return liveDir.resolveSibling(liveDir.getFileName() + ".prev");
    }

    private void restore(Path previous, Path liveDir, PublishException failure) {
        try {
            mover.move(previous, liveDir);
            log.warn("[Publish] swap failed, restored previous tree at {}", liveDir);
        } catch (IOException restoreError) {
            log.error("[Publish] swap failed and restore failed; previous tree left at {}", previous, restoreError);
            failure.addSuppressed(restoreError);
        }
    }

    private void removeLeftover(Path previous) throws PublishException {
        if (!Files.exists(previous)) {
            return;
        }
        log.warn("[Publish] removing leftover {} from an earlier publish", previous);
        try {
            FileSystemUtils.deleteRecursively(previous);
        } catch (IOException e) {
            throw new PublishException("Failed to remove leftover " + previous, e);
        }
    }

    void fixUpStagedTree(Path stagedDir) throws PublishException {
        if (Files.getFileAttributeView(stagedDir, PosixFileAttributeView.class) == null) {
            log.debug("[Publish] no POSIX attributes on {}, skipping permission fix-up", stagedDir);
            return;
        }

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(stagedDir)) {
            paths = walk.collect(Collectors.toList());
        } catch (IOException e) {
            throw new PublishException("Failed to walk staged tree " + stagedDir, e);
        }

        for (Path path : paths) {
            try {
                Files.setPosixFilePermissions(path, Files.isDirectory(path) ? DIR_PERMISSIONS : FILE_PERMISSIONS);
            } catch (IOException e) {
                throw new PublishException("Failed to set permissions on " + path, e);
            }
        }

        if (owner == null && group == null) {
            return;
        }
        // 소유권 변경 실패는 치명적이지 않음
        try {
            UserPrincipalLookupService lookup = stagedDir.getFileSystem().getUserPrincipalLookupService();
            for (Path path : paths) {
                PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
                if (owner != null) {
                    view.setOwner(lookup.lookupPrincipalByName(owner));
                }
                if (group != null) {
                    GroupPrincipal groupPrincipal = lookup.lookupPrincipalByGroupName(group);
                    view.setGroup(groupPrincipal);
                }
            }
            log.info("[Publish] ownership set owner={} group={}", owner, group);
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("[Publish] failed to set ownership owner={} group={}: {}", owner, group, e.getMessage());
        }
    }
}
