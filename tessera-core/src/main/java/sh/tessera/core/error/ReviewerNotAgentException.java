// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import java.math.BigInteger;

/**
 * Thrown when the reviewer id of a review does not resolve in the bound registry.
 *
 * <p>The underlying check is the same as {@link AgentNotFoundException}; the
 * separate type tells a bad reviewer id apart from a bad subject id.
 *
 * @since 0.1.0
 */
public final class ReviewerNotAgentException extends CredentialException {

    private final BigInteger reviewerId;

    public ReviewerNotAgentException(final BigInteger reviewerId) {
        super(ErrorKind.REVIEWER_NOT_AGENT, "Reviewer is not a registered subject: " + reviewerId);
        this.reviewerId = reviewerId;
    }

    public BigInteger reviewerId() {
        return reviewerId;
    }
}
