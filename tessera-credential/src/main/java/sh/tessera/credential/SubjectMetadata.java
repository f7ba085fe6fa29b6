// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.util.List;

import sh.tessera.core.credential.InterfaceId;
import sh.tessera.core.credential.MetadataEntry;
import sh.tessera.core.credential.SubjectId;
import sh.tessera.core.types.Address;

/**
 * Per-subject metadata, writable by anyone the subject registry authorizes
 * for the subject.
 */
public interface SubjectMetadata {

    InterfaceId INTERFACE_ID = InterfaceId.ofSignatures(
            "setMetadata(uint256,string,bytes)",
            "setMetadata(uint256,(string,bytes)[])",
            "getMetadata(uint256,string)");

    /**
     * Writes one metadata value for a subject.
     *
     * @throws sh.tessera.core.error.AgentNotFoundException if the subject does not resolve
     * @throws sh.tessera.core.error.NotAuthorizedException if the caller has no standing for the subject
     */
    void setSubjectMetadata(Address caller, SubjectId subjectId, String key, byte[] value);

    /**
     * Writes several metadata values for a subject under a single authorization.
     * A one-time approval is consumed once for the whole batch.
     *
     * @throws sh.tessera.core.error.AgentNotFoundException if the subject does not resolve
     * @throws sh.tessera.core.error.NotAuthorizedException if the caller has no standing for the subject
     */
    void setSubjectMetadata(Address caller, SubjectId subjectId, List<MetadataEntry> entries);

    /**
     * Reads a metadata value. No authorization.
     *
     * @return the value, or an empty array if never written
     */
    byte[] getSubjectMetadata(SubjectId subjectId, String key);
}
