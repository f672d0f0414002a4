package io.kartlink.protocol;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read-only mapping between symbolic protocol names and their numeric ids.
 *
 * <p>Component and command names are scoped by component type, so the same
 * name may map to different ids under different types.
 */
public interface ProtocolCatalog {
    OptionalInt messageTypeId(String name);

    OptionalInt componentTypeId(String name);

    OptionalInt componentId(String componentType, String componentName);

    OptionalInt commandId(String componentType, String commandName);

    OptionalInt valueTypeId(String name);

    Optional<String> messageTypeName(int id);

    Optional<String> componentTypeName(int id);

    Optional<String> componentName(int componentType, int componentId);

    Optional<String> commandName(int componentType, int commandId);

    Optional<String> valueTypeName(int id);

    /**
     * Like {@link #commandId(String, String)} but fails when the entry is missing.
     */
    default int requireCommandId(String componentType, String commandName) {
        return commandId(componentType, commandName).orElseThrow(() ->
                new IllegalArgumentException("Unknown command " + componentType + "." + commandName));
    }

    default int requireComponentTypeId(String name) {
        return componentTypeId(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown component type " + name));
    }

    default int requireMessageTypeId(String name) {
        return messageTypeId(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown message type " + name));
    }
}
