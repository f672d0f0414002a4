package io.kartlink.protocol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable {@link ProtocolCatalog} built once at startup.
 */
public final class StaticProtocolCatalog implements ProtocolCatalog {
    private final NameTable messageTypes;
    private final NameTable componentTypes;
    private final NameTable valueTypes;
    private final Map<Integer, NameTable> components;
    private final Map<Integer, NameTable> commands;

    private StaticProtocolCatalog(Builder b) {
        this.messageTypes = b.messageTypes.freeze();
        this.componentTypes = b.componentTypes.freeze();
        this.valueTypes = b.valueTypes.freeze();
        this.components = freezeScoped(b.components, componentTypes);
        this.commands = freezeScoped(b.commands, componentTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tables for the shared message, component and value type enums plus the
     * system monitor entries used by the uplink and time sync.
     */
    public static StaticProtocolCatalog standard() {
        return builder()
                .messageType("COMMAND", ProtocolIds.MESSAGE_COMMAND)
                .messageType("STATUS", ProtocolIds.MESSAGE_STATUS)
                .messageType("ACK", ProtocolIds.MESSAGE_ACK)
                .messageType("ERROR", ProtocolIds.MESSAGE_ERROR)
                .componentType("LIGHTS", 0)
                .componentType("MOTORS", 1)
                .componentType("BATTERIES", 2)
                .componentType("CONTROLS", 3)
                .componentType("NAVIGATION", 4)
                .componentType("SYSTEM_MONITOR", ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR)
                .valueType("BOOLEAN", 0)
                .valueType("INT8", 1)
                .valueType("UINT8", ProtocolIds.VALUE_UINT8)
                .valueType("INT16", 3)
                .valueType("UINT16", ProtocolIds.VALUE_UINT16)
                .valueType("INT24", 5)
                .valueType("UINT24", ProtocolIds.VALUE_UINT24)
                .component("SYSTEM_MONITOR", "RASPBERRY_PI", 1)
                .component("SYSTEM_MONITOR", "ESP32_MAIN", 2)
                .component("SYSTEM_MONITOR", "UPLINK_MANAGER", ProtocolIds.SYSTEM_MONITOR_UPLINK_MANAGER)
                .component("SYSTEM_MONITOR", "TIME_MASTER", ProtocolIds.SYSTEM_MONITOR_TIME_MASTER)
                .component("SYSTEM_MONITOR", "ALL", ProtocolIds.GROUP_ALL)
                .command("SYSTEM_MONITOR", "UPLINK_STATUS", ProtocolIds.COMMAND_UPLINK_STATUS)
                .command("SYSTEM_MONITOR", "UPLINK_QUEUE_SIZE", ProtocolIds.COMMAND_UPLINK_QUEUE_SIZE)
                .command("SYSTEM_MONITOR", "UPLINK_AVG_LATENCY_MS", ProtocolIds.COMMAND_UPLINK_AVG_LATENCY_MS)
                .command("SYSTEM_MONITOR", "UPLINK_AVG_THROUGHPUT_KBPS", 3)
                .command("SYSTEM_MONITOR", "PING", ProtocolIds.COMMAND_PING)
                .command("SYSTEM_MONITOR", "PONG", ProtocolIds.COMMAND_PONG)
                .command("SYSTEM_MONITOR", "ROUNDTRIPTIME_MS", ProtocolIds.COMMAND_ROUNDTRIPTIME_MS)
                .command("SYSTEM_MONITOR", "SET_TIME", ProtocolIds.COMMAND_SET_TIME)
                .build();
    }

    @Override
    public OptionalInt messageTypeId(String name) {
        return messageTypes.id(name);
    }

    @Override
    public OptionalInt componentTypeId(String name) {
        return componentTypes.id(name);
    }

    @Override
    public OptionalInt componentId(String componentType, String componentName) {
        return scoped(components, componentType).map(t -> t.id(componentName)).orElse(OptionalInt.empty());
    }

    @Override
    public OptionalInt commandId(String componentType, String commandName) {
        return scoped(commands, componentType).map(t -> t.id(commandName)).orElse(OptionalInt.empty());
    }

    @Override
    public OptionalInt valueTypeId(String name) {
        return valueTypes.id(name);
    }

    @Override
    public Optional<String> messageTypeName(int id) {
        return messageTypes.name(id);
    }

    @Override
    public Optional<String> componentTypeName(int id) {
        return componentTypes.name(id);
    }

    @Override
    public Optional<String> componentName(int componentType, int componentId) {
        NameTable table = components.get(componentType);
        return table == null ? Optional.empty() : table.name(componentId);
    }

    @Override
    public Optional<String> commandName(int componentType, int commandId) {
        NameTable table = commands.get(componentType);
        return table == null ? Optional.empty() : table.name(commandId);
    }

    @Override
    public Optional<String> valueTypeName(int id) {
        return valueTypes.name(id);
    }

    private Optional<NameTable> scoped(Map<Integer, NameTable> tables, String componentType) {
        OptionalInt typeId = componentTypeId(componentType);
        if (typeId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(typeId.getAsInt()));
    }

    private static Map<Integer, NameTable> freezeScoped(Map<String, NameTable> byTypeName,
                                                        NameTable componentTypes) {
        Map<Integer, NameTable> out = new HashMap<>();
        for (Map.Entry<String, NameTable> e : byTypeName.entrySet()) {
            int typeId = componentTypes.id(e.getKey()).orElseThrow(() ->
                    new IllegalStateException("Entries registered for unknown component type " + e.getKey()));
            out.put(typeId, e.getValue().freeze());
        }
        return Map.copyOf(out);
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
    }

    private static final class NameTable {
        private final Map<String, Integer> ids;
        private final Map<Integer, String> names;

        private NameTable() {
            this(new HashMap<>(), new HashMap<>());
        }

        private NameTable(Map<String, Integer> ids, Map<Integer, String> names) {
            this.ids = ids;
            this.names = names;
        }

        void put(String name, int id) {
            String k = key(name);
            if (k.isEmpty()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            Integer previous = ids.putIfAbsent(k, id);
            if (previous != null && previous != id) {
                throw new IllegalArgumentException("Duplicate protocol name " + k);
            }
            names.putIfAbsent(id, k);
        }

        NameTable freeze() {
            return new NameTable(Map.copyOf(ids), Map.copyOf(names));
        }

        OptionalInt id(String name) {
            Integer id = ids.get(key(name));
            return id == null ? OptionalInt.empty() : OptionalInt.of(id);
        }

        Optional<String> name(int id) {
            return Optional.ofNullable(names.get(id));
        }
    }

    public static final class Builder {
        private final NameTable messageTypes = new NameTable();
        private final NameTable componentTypes = new NameTable();
        private final NameTable valueTypes = new NameTable();
        private final Map<String, NameTable> components = new HashMap<>();
        private final Map<String, NameTable> commands = new HashMap<>();

        private Builder() {
        }

        public Builder messageType(String name, int id) {
            messageTypes.put(name, id);
            return this;
        }

        public Builder componentType(String name, int id) {
            componentTypes.put(name, id);
            return this;
        }

        public Builder valueType(String name, int id) {
            valueTypes.put(name, id);
            return this;
        }

        public Builder component(String componentType, String name, int id) {
            components.computeIfAbsent(key(componentType), k -> new NameTable()).put(name, id);
            return this;
        }

        public Builder command(String componentType, String name, int id) {
            commands.computeIfAbsent(key(componentType), k -> new NameTable()).put(name, id);
            return this;
        }

        public StaticProtocolCatalog build() {
            return new StaticProtocolCatalog(this);
        }
    }
}
