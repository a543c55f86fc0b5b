package com.yourcompany.entraid.tools.model;

/**
 * One (role, member) pair discovered while walking the directory roles.
 */
public final class RoleAssignment {

    private final DirectoryRole role;
    private final DirectoryMember member;

    public RoleAssignment(DirectoryRole role, DirectoryMember member) {
        this.role = role;
        this.member = member;
    }

    public DirectoryRole getRole() {
        return role;
    }

    public DirectoryMember getMember() {
        return member;
    }

    /**
     * @return The member's UPN, or its object id for members that have none.
     */
    public String getMemberKey() {
        return member.hasUserPrincipalName() ? member.getUserPrincipalName() : member.getId();
    }
}
