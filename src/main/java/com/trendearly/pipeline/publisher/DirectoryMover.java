package com.trendearly.pipeline.publisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@FunctionalInterface
public interface DirectoryMover {

    void move(Path source, Path target) throws IOException;

    /** Single rename(2); fails instead of falling back to copy+delete. */
    static DirectoryMover atomicRename() {
        return (source, target) -> Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }
}
