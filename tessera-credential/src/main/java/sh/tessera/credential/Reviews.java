// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import sh.tessera.core.credential.InterfaceId;
import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.types.Address;

/**
 * Directional reviews between subjects.
 *
 * <p>{@code (a, b)} and {@code (b, a)} are independent entries. A subject may
 * review itself. Submitting again for the same pair replaces the review.
 */
public interface Reviews {

    InterfaceId INTERFACE_ID = InterfaceId.ofSignatures(
            "submitReview(uint256,uint256,bytes)",
            "getReview(uint256,uint256)");

    /**
     * Stores a review on behalf of {@code reviewerId}. The caller must be
     * authorized for the reviewer, not for the reviewed subject.
     *
     * @throws sh.tessera.core.error.ReviewerNotAgentException if the reviewer does not resolve
     * @throws sh.tessera.core.error.NotAuthorizedException    if the caller has no standing for the reviewer
     */
    void submitReview(Address caller, SubjectId reviewerId, SubjectId reviewedId, byte[] data);

    /**
     * @return the review, or an empty array if none was submitted
     */
    byte[] getReview(SubjectId reviewerId, SubjectId reviewedId);
}
