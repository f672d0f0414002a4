package io.kartlink.cli;

import io.kartlink.config.CollectorConfig;
import io.kartlink.config.CollectorSettings;
import io.kartlink.model.Role;
import io.kartlink.model.TelemetryEvent;
import io.kartlink.model.TelemetryRecord;
import io.kartlink.protocol.ProtocolIds;
import io.kartlink.runtime.CollectorRuntime;
import io.kartlink.storage.HistoryQuery;
import io.kartlink.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

@Command(
        name = "kartlink",
        mixinStandardHelpOptions = true,
        description = "KartLink telemetry collector CLI",
        subcommands = {
                KartLinkCommand.InitCommand.class,
                KartLinkCommand.RunCommand.class,
                KartLinkCommand.StatsCommand.class,
                KartLinkCommand.HistoryCommand.class,
                KartLinkCommand.LatestCommand.class,
                KartLinkCommand.ComponentsCommand.class,
                KartLinkCommand.PendingCommand.class,
                KartLinkCommand.RecordCommand.class,
                KartLinkCommand.PruneCommand.class,
                KartLinkCommand.MetricsCommand.class,
                KartLinkCommand.SettingsCommand.class,
                KartLinkCommand.SchemaMigrationsCommand.class
        }
)
public final class KartLinkCommand implements Runnable {
    @Option(names = {"--root"}, description = "Collector data root directory", defaultValue = CollectorConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--db"}, description = "Override the SQLite database file")
    String dbFile;

    @Option(names = {"--role"}, description = "vehicle or remote; overrides the settings file")
    String role;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | stats | history | latest | components | pending | record | prune | metrics | settings | schema-migrations");
    }

    CollectorConfig config() {
        return CollectorConfig.fromRoot(root).withDbFile(dbFile);
    }

    CollectorSettings settings() {
        CollectorSettings settings = CollectorSettings.load(config());
        if (role != null && !role.isBlank()) {
            settings = settings.withRole(Role.fromString(role));
        }
        return settings;
    }

    CollectorRuntime runtime() {
        return runtime(settings());
    }

    CollectorRuntime runtime(CollectorSettings settings) {
        return CollectorRuntime.standalone(config(), settings);
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized KartLink at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "run", description = "Run the collector until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Option(names = {"--remote"}, description = "WebSocket URL of the remote collector; overrides the settings file")
        String remote;

        @Override
        public Integer call() throws Exception {
            CollectorSettings settings = parent.settings();
            if (remote != null && !remote.isBlank()) {
                settings = settings.withRemoteUrl(remote.trim());
            }
            CollectorRuntime runtime = parent.runtime(settings);
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "kartlink-shutdown-hook"));
            runtime.start();
            runtime.awaitStop();
            return 0;
        }
    }

    @Command(name = "stats", description = "Show store counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "history", description = "List records, newest first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Option(names = {"--component-type"}, description = "Filter by component type id")
        Integer componentType;

        @Option(names = {"--component-id"}, description = "Filter by component id")
        Integer componentId;

        @Option(names = {"--command"}, description = "Filter by command id")
        Integer commandId;

        @Option(names = {"--from-ms"}, description = "Oldest recorded time, epoch ms")
        Long fromMs;

        @Option(names = {"--to-ms"}, description = "Newest recorded time, epoch ms")
        Long toMs;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            boolean filtered = componentType != null || componentId != null || commandId != null
                    || fromMs != null || toMs != null;
            if (!filtered) {
                System.out.println(Jsons.toJson(runtime.history(limit, offset)));
                return 0;
            }
            HistoryQuery query = HistoryQuery.page(limit, offset)
                    .withTimeRange(fromMs, toMs)
                    .withComponent(componentType, componentId, commandId);
            System.out.println(Jsons.toJson(runtime.queryHistory(query)));
            return 0;
        }
    }

    @Command(name = "latest", description = "Show the newest record of one component")
    static final class LatestCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Parameters(index = "0", description = "Component type id")
        int componentType;

        @Parameters(index = "1", description = "Component id")
        int componentId;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            Optional<TelemetryRecord> latest = runtime.latestFor(componentType, componentId);
            if (latest.isEmpty()) {
                System.out.println("{\"error\":\"no record for component\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(latest.get()));
            return 0;
        }
    }

    @Command(name = "components", description = "List components seen in the log with their last value")
    static final class ComponentsCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.activeComponents()));
            return 0;
        }
    }

    @Command(name = "pending", description = "List records not yet acknowledged by the remote, oldest first")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.pending(limit)));
            return 0;
        }
    }

    @Command(name = "record", description = "Append one STATUS record by hand")
    static final class RecordCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Option(names = {"--component-type"}, required = true, description = "Component type id")
        int componentType;

        @Option(names = {"--component-id"}, required = true, description = "Component id")
        int componentId;

        @Option(names = {"--command"}, required = true, description = "Command id")
        int commandId;

        @Option(names = {"--value-type"}, defaultValue = "2", description = "Value type id")
        int valueType;

        @Option(names = {"--value"}, required = true, description = "Value")
        long value;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            long now = Instant.now().toEpochMilli();
            OptionalLong id = runtime.store().append(TelemetryEvent.receivedNow(
                    now, ProtocolIds.MESSAGE_STATUS, componentType, componentId, commandId, valueType, value));
            if (id.isEmpty()) {
                System.out.println("{\"error\":\"append failed\"}");
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id.getAsLong());
            out.put("recordedAtMs", now);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "prune", description = "Drop uploaded records past retention and enforce the record cap")
    static final class PruneCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.prune()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.print(runtime.metricsText());
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.settings()));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        KartLinkCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            CollectorRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.database().listSchemaMigrations(limit)));
            return 0;
        }
    }
}
