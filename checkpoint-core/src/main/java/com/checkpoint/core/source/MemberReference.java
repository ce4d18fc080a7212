package com.checkpoint.core.source;

import java.util.Objects;

/**
 * Access to a member through a named receiver, e.g. {@code cfg.dryRun} or {@code cfg.isDryRun()}.
 *
 * @param receiver simple name of the receiver
 * @param member accessed field or method name
 * @param call whether the access is a method call
 */
public record MemberReference(String receiver, String member, boolean call) {

    public MemberReference {
        Objects.requireNonNull(receiver, "receiver must not be null");
        Objects.requireNonNull(member, "member must not be null");
    }
}
