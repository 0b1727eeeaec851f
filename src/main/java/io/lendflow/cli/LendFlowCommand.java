package io.lendflow.cli;

import io.lendflow.config.LendFlowConfig;
import io.lendflow.model.ApplicationState;
import io.lendflow.observability.AuditEntry;
import io.lendflow.observability.AuditIntegrityReport;
import io.lendflow.observability.AuditQuery;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.runtime.LendFlowRuntime;
import io.lendflow.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "lendflow",
        mixinStandardHelpOptions = true,
        description = "LendFlow mortgage workflow engine CLI",
        subcommands = {
                LendFlowCommand.InitCommand.class,
                LendFlowCommand.ValidatePatternsCommand.class,
                LendFlowCommand.AuditVerifyCommand.class,
                LendFlowCommand.AuditSearchCommand.class,
                LendFlowCommand.AuditCountsCommand.class,
                LendFlowCommand.AuditPurgeCommand.class,
                LendFlowCommand.ApplicationCommand.class,
                LendFlowCommand.ErrorsCommand.class
        }
)
public final class LendFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | validate-patterns | audit-verify | audit-search | audit-counts | audit-purge | application | errors");
    }

    LendFlowRuntime runtime() {
        LendFlowRuntime runtime = new LendFlowRuntime(LendFlowConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static LocalDate parseDate(String raw) {
        return raw == null || raw.isBlank() ? null : LocalDate.parse(raw.trim());
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.initOutcome()));
            }
            return 0;
        }
    }

    @Command(name = "validate-patterns", description = "Load and validate a collaboration pattern file")
    static final class ValidatePatternsCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--file"}, description = "Pattern file; defaults to <root>/patterns.json")
        String file;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                Path path = file == null || file.isBlank() ? runtime.config().patternsFile() : Path.of(file);
                System.out.println(Jsons.toJson(runtime.validatePatterns(path)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of audit segments")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--segment"}, description = "Segment file name (audit_YYYY-MM-DD.log); all segments when omitted")
        String segment;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                List<AuditIntegrityReport> reports = runtime.verifyAudit(segment);
                boolean ok = reports.stream().allMatch(AuditIntegrityReport::intact);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("ok", ok);
                out.put("segments", reports);
                System.out.println(Jsons.toJson(out));
                return ok ? 0 : 1;
            }
        }
    }

    @Command(name = "audit-search", description = "Search audit entries")
    static final class AuditSearchCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--from"}, description = "First day (YYYY-MM-DD, inclusive)")
        String from;

        @Option(names = {"--to"}, description = "Last day (YYYY-MM-DD, inclusive)")
        String to;

        @Option(names = {"--event-type"}, description = "Event type filter; repeatable")
        List<String> eventTypes;

        @Option(names = {"--user-id"}, description = "Filter by user id")
        String userId;

        @Option(names = {"--agent-id"}, description = "Filter by agent id")
        String agentId;

        @Option(names = {"--resource-id"}, description = "Filter by resource id")
        String resourceId;

        @Option(names = {"--action"}, description = "Filter by action name")
        String action;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of matching entries")
        int limit;

        @Override
        public Integer call() {
            Set<String> types = eventTypes == null ? Set.of() : new LinkedHashSet<>(eventTypes);
            AuditQuery query = AuditQuery.all()
                    .between(parseDate(from), parseDate(to))
                    .withEventTypes(types)
                    .withUserId(userId)
                    .withAgentId(agentId)
                    .withResourceId(resourceId)
                    .withAction(action);
            try (LendFlowRuntime runtime = parent.runtime()) {
                List<AuditEntry> rows = runtime.searchAudit(query);
                if (limit > 0 && rows.size() > limit) {
                    rows = rows.subList(0, limit);
                }
                for (AuditEntry row : rows) {
                    System.out.println(Jsons.toCompactJson(row));
                }
            }
            return 0;
        }
    }

    @Command(name = "audit-counts", description = "Count audit events by type")
    static final class AuditCountsCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--from"}, description = "First day (YYYY-MM-DD, inclusive)")
        String from;

        @Option(names = {"--to"}, description = "Last day (YYYY-MM-DD, inclusive)")
        String to;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.auditCounts(parseDate(from), parseDate(to))));
            }
            return 0;
        }
    }

    @Command(name = "audit-purge", description = "Delete audit segments older than the retention window")
    static final class AuditPurgeCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("retentionDays", runtime.auditLog().policy().retentionDays());
                out.put("removed", runtime.purgeAudit());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "application", description = "Create, transition or inspect an application")
    static final class ApplicationCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--id"}, required = true, description = "Application id")
        String applicationId;

        @Option(names = {"--create"}, description = "Create the application in state initiated")
        boolean create;

        @Option(names = {"--to"}, description = "Target state for a transition")
        String targetState;

        @Option(names = {"--reason"}, defaultValue = "cli", description = "Transition reason")
        String reason;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                if (create) {
                    runtime.createApplication(applicationId);
                }
                if (targetState != null && !targetState.isBlank()) {
                    LendFlowRuntime.TransitionOutcome outcome = runtime.transitionApplication(
                            applicationId, ApplicationState.fromString(targetState), reason);
                    System.out.println(Jsons.toJson(outcome));
                    return outcome.accepted() ? 0 : 1;
                }
                Optional<LendFlowRuntime.ApplicationView> view = runtime.application(applicationId);
                if (view.isEmpty()) {
                    System.out.println("Application not found: " + applicationId);
                    return 1;
                }
                System.out.println(Jsons.toJson(view.get()));
            }
            return 0;
        }
    }

    @Command(name = "errors", description = "Show error history or statistics")
    static final class ErrorsCommand implements Callable<Integer> {
        @ParentCommand
        LendFlowCommand parent;

        @Option(names = {"--application-id"}, description = "Application id; statistics span all applications when omitted")
        String applicationId;

        @Option(names = {"--stats"}, description = "Print statistics instead of history")
        boolean stats;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max history records, most recent first")
        int limit;

        @Override
        public Integer call() {
            try (LendFlowRuntime runtime = parent.runtime()) {
                if (stats || applicationId == null) {
                    System.out.println(Jsons.toJson(runtime.errorStatistics(applicationId)));
                    return 0;
                }
                List<ErrorRecord> history = runtime.errorHistory(applicationId, limit);
                System.out.println(Jsons.toJson(history));
            }
            return 0;
        }
    }
}
