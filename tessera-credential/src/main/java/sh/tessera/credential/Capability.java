// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import sh.tessera.core.credential.InterfaceId;

/**
 * Structural interfaces a credential instance can declare.
 */
public enum Capability {
    INTROSPECTION(SupportsInterface.class, SupportsInterface.INTERFACE_ID),
    SUBJECT_METADATA(SubjectMetadata.class, SubjectMetadata.INTERFACE_ID),
    INSTANCE_METADATA(InstanceMetadata.class, InstanceMetadata.INTERFACE_ID),
    REVIEWS(Reviews.class, Reviews.INTERFACE_ID),
    INSTANCE_OPERATIONS(CredentialOperations.class, CredentialOperations.INTERFACE_ID);

    private final Class<?> type;
    private final InterfaceId interfaceId;

    Capability(Class<?> type, InterfaceId interfaceId) {
        this.type = type;
        this.interfaceId = interfaceId;
    }

    public Class<?> type() {
        return type;
    }

    public InterfaceId interfaceId() {
        return interfaceId;
    }

    /**
     * @return the capability with this identifier, or empty if unknown
     */
    public static Optional<Capability> fromInterfaceId(InterfaceId interfaceId) {
        Objects.requireNonNull(interfaceId, "interfaceId");
        return Arrays.stream(values()).filter(c -> c.interfaceId.equals(interfaceId)).findFirst();
    }

    /**
     * @return every capability whose Java interface {@code target} implements
     */
    public static Set<Capability> declaredBy(Object target) {
        Objects.requireNonNull(target, "target");
        Set<Capability> declared = EnumSet.noneOf(Capability.class);
        for (Capability capability : values()) {
            if (capability.type.isInstance(target)) {
                declared.add(capability);
            }
        }
        return declared;
    }
}
