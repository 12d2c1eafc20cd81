package io.rangekeeper.model;

public record Requester(String principalId, Role role) {
    public enum Role {
        OWNER,
        ADMIN,
        SYSTEM
    }

    public static Requester principal(String principalId) {
        return new Requester(principalId, Role.OWNER);
    }

    public static Requester admin(String principalId) {
        return new Requester(principalId, Role.ADMIN);
    }

    public static Requester system() {
        return new Requester(null, Role.SYSTEM);
    }

    public boolean privileged() {
        return role == Role.ADMIN || role == Role.SYSTEM;
    }

    public boolean mayOperateOn(InstanceRecord record) {
        return privileged() || record.ownedBy(principalId);
    }

    public String actor() {
        return switch (role) {
            case SYSTEM -> "system";
            case ADMIN -> "admin:" + principalId;
            case OWNER -> "principal:" + principalId;
        };
    }
}
