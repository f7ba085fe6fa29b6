// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.tessera.core.credential.CredentialEvent;
import sh.tessera.core.credential.InstanceCreated;
import sh.tessera.core.credential.MetadataChanged;
import sh.tessera.core.credential.OwnershipTransferred;
import sh.tessera.core.credential.RegistryUpdated;
import sh.tessera.core.credential.ReviewSubmitted;
import sh.tessera.primitives.Hex;

/**
 * JSON rendering of credential events for off-path indexers.
 *
 * <p>Every object carries a {@code type} field naming the event. Addresses
 * render as hex strings, subject ids as decimal strings and byte payloads as
 * {@code 0x}-prefixed hex.
 *
 * <pre>{@code
 * {"type":"ReviewSubmitted","source":"0x...","reviewerId":"1","reviewedId":"2","data":"0x6772656174"}
 * }</pre>
 */
public final class EventJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventJson() {}

    /**
     * Renders an event as a JSON object node.
     *
     * @param event the event
     * @return a new node
     */
    public static ObjectNode toNode(CredentialEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", event.getClass().getSimpleName());
        node.put("source", event.source().value());
        if (event instanceof MetadataChanged e) {
            if (e.subjectId() == null) {
                node.putNull("subjectId");
            } else {
                node.put("subjectId", e.subjectId().value().toString());
            }
            node.put("key", e.key());
            node.put("value", Hex.encode(e.value()));
        } else if (event instanceof ReviewSubmitted e) {
            node.put("reviewerId", e.reviewerId().value().toString());
            node.put("reviewedId", e.reviewedId().value().toString());
            node.put("data", Hex.encode(e.data()));
        } else if (event instanceof OwnershipTransferred e) {
            node.put("previousOwner", e.previousOwner().value());
            node.put("newOwner", e.newOwner().value());
        } else if (event instanceof RegistryUpdated e) {
            node.put("previousRegistry", e.previousRegistry().value());
            node.put("newRegistry", e.newRegistry().value());
        } else if (event instanceof InstanceCreated e) {
            node.put("instance", e.instance().value());
            node.put("registry", e.registry().value());
            node.put("name", e.name());
            node.put("creator", e.creator().value());
        }
        return node;
    }

    /**
     * Renders an event as a compact JSON string.
     *
     * @param event the event
     * @return the JSON text
     * @throws IllegalStateException if Jackson fails to write the tree
     */
    public static String toJson(CredentialEvent event) {
        try {
            return MAPPER.writeValueAsString(toNode(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render event " + event.getClass().getSimpleName(), e);
        }
    }
}
