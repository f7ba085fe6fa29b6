// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import java.math.BigInteger;

/**
 * Thrown when a subject id does not resolve in the bound registry.
 *
 * @since 0.1.0
 */
public final class AgentNotFoundException extends CredentialException {

    private final BigInteger subjectId;

    public AgentNotFoundException(final BigInteger subjectId) {
        super(ErrorKind.AGENT_NOT_FOUND, "Subject not found in registry: " + subjectId);
        this.subjectId = subjectId;
    }

    public BigInteger subjectId() {
        return subjectId;
    }
}
