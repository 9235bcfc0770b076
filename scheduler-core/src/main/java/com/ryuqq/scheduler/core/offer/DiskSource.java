package com.ryuqq.scheduler.core.offer;

/**
 * 디스크 리소스의 출처.
 *
 * <p>ROOT 디스크는 경로가 없고, PATH/MOUNT 디스크는 Agent가 노출한 경로를 가집니다.</p>
 *
 * @param type 디스크 종류
 * @param path 디스크 경로 (ROOT인 경우 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiskSource(
    Type type,
    String path
) {

    public static final DiskSource ROOT = new DiskSource(Type.ROOT, null);

    public DiskSource {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == Type.ROOT && path != null) {
            throw new IllegalArgumentException("ROOT disk cannot have a path (current: " + path + ")");
        }
        if (type != Type.ROOT && (path == null || path.isBlank())) {
            throw new IllegalArgumentException(type + " disk requires a path");
        }
    }

    public static DiskSource path(String path) {
        return new DiskSource(Type.PATH, path);
    }

    public static DiskSource mount(String path) {
        return new DiskSource(Type.MOUNT, path);
    }

    /**
     * 디스크 종류.
     */
    public enum Type {
        ROOT,
        PATH,
        MOUNT
    }
}
