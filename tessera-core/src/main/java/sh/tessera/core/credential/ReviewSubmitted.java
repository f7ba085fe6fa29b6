// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import java.util.Arrays;
import java.util.Objects;

import sh.tessera.core.types.Address;

/**
 * A review was stored for the ordered pair {@code (reviewerId, reviewedId)}.
 *
 * @param source     the instance that stored the review
 * @param reviewerId the reviewing subject
 * @param reviewedId the reviewed subject
 * @param data       the review payload
 */
public record ReviewSubmitted(Address source, SubjectId reviewerId, SubjectId reviewedId, byte[] data)
        implements CredentialEvent {

    public ReviewSubmitted {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reviewerId, "reviewerId");
        Objects.requireNonNull(reviewedId, "reviewedId");
        Objects.requireNonNull(data, "data");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReviewSubmitted other)) return false;
        return source.equals(other.source)
            && reviewerId.equals(other.reviewerId)
            && reviewedId.equals(other.reviewedId)
            && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, reviewerId, reviewedId, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "ReviewSubmitted[source=" + source + ", reviewerId=" + reviewerId
            + ", reviewedId=" + reviewedId + ", data=(" + data.length + " bytes)]";
    }
}
