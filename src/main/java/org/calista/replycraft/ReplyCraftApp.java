package org.calista.replycraft;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.combos.CustomCombo;
import org.calista.replycraft.core.ReplyCraftKernel;
import org.calista.replycraft.core.ReplyStyleEngine;
import org.calista.replycraft.model.*;
import org.calista.replycraft.usage.CombinationCount;
import org.calista.replycraft.usage.SelectionSource;
import org.calista.replycraft.usage.UsageStats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * ReplyCraftApp — interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config, catalog, persisted state)
 *  2) run loop: one command per line, see {@link #HELP}
 *  3) close kernel (final flush)
 */
public final class ReplyCraftApp {

    private static final Logger log = LogManager.getLogger(ReplyCraftApp.class);

    static final int RANK_LIMIT = 5;
    static final int TOP_LIMIT = 5;
    static final String EMPTY_SLOT = "-";

    static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  rank <text>                 ranked styles for a reply to <text>",
            "  default <text>              single best guess for <text>",
            "  use <p> <v> <r> <l>         record a combination ('-' leaves a slot empty)",
            "  persona <id>                record a persona's combination",
            "  save <p> <v> <r> <l> <name> save a named custom combo",
            "  combo <id|name>             record a custom combo",
            "  combos                      list custom combos",
            "  fav <kind> <id>             toggle a favorite (kind: personality|vocabulary|rhetoric|lengthPacing)",
            "  top                         most used combinations",
            "  stats                       usage statistics",
            "  exit");

    private final ReplyStyleEngine engine;

    public ReplyCraftApp(ReplyStyleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public static void main(String[] args) throws IOException {
        Path cfgPath = Path.of(args.length > 0 ? args[0] : "config/replycraft.json");
        try (ReplyCraftKernel kernel = ReplyCraftKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath)) {
            new ReplyCraftApp(kernel.engine()).runConsoleLoop();
        }
    }

    void runConsoleLoop() {
        log.info("ReplyCraft started. catalog.entities={}, personas={}",
                engine.catalog().size(), engine.catalog().personas().size());
        System.out.println(HELP);

        try (Scanner sc = new Scanner(System.in)) {
            while (true) {
                System.out.print("> ");
                if (!sc.hasNextLine()) break;
                String line = sc.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) break;
                if (line.isEmpty()) continue;
                System.out.println(handle(line));
            }
        }
        System.out.println("Bye.");
    }

    /**
     * Executes one command line and returns the text to print.
     * Bad input yields an error line, never an exception.
     */
    public String handle(String line) {
        if (line == null || line.isBlank()) return HELP;
        String trimmed = line.trim();
        int sp = trimmed.indexOf(' ');
        String cmd = (sp < 0 ? trimmed : trimmed.substring(0, sp)).toLowerCase(Locale.ROOT);
        String arg = sp < 0 ? "" : trimmed.substring(sp + 1).trim();

        try {
            switch (cmd) {
                case "rank":
                    return rank(arg);
                case "default":
                    return smartDefault(arg);
                case "use":
                    return use(arg);
                case "persona":
                    return persona(arg);
                case "save":
                    return save(arg);
                case "combo":
                    return combo(arg);
                case "combos":
                    return combos();
                case "fav":
                    return fav(arg);
                case "top":
                    return top();
                case "stats":
                    return stats();
                case "help":
                    return HELP;
                default:
                    return "Unknown command: " + cmd + System.lineSeparator() + HELP;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Rejected command '{}': {}", trimmed, e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    // -------------------- commands --------------------

    private String rank(String text) {
        ReplyContext ctx = engine.context(text, true, List.of());
        List<Suggestion> list = engine.rank(ctx, RANK_LIMIT);
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (Suggestion s : list) {
            if (sb.length() > 0) sb.append(System.lineSeparator());
            sb.append(String.format(Locale.ROOT, "%d. [%d] %s", i++, s.breakdown.total, s.key()));
            if (!s.breakdown.reasons.isEmpty()) sb.append("  (").append(String.join("; ", s.breakdown.reasons)).append(')');
        }
        return sb.length() == 0 ? "No suggestions." : sb.toString();
    }

    private String smartDefault(String text) {
        SmartDefault d = engine.resolve(engine.context(text, true, List.of()));
        return String.format(Locale.ROOT, "%s (confidence %.2f): %s", d.candidate.key(), d.confidence, d.reason);
    }

    private String use(String arg) {
        String[] parts = arg.isEmpty() ? new String[0] : arg.split("\\s+");
        if (parts.length != EntityKind.values().length) {
            throw new IllegalArgumentException("use needs " + EntityKind.values().length + " ids, '-' for an empty slot");
        }
        Candidate c = candidate(parts);
        if (c.isEmpty()) throw new IllegalArgumentException("Nothing selected");
        engine.recordSelection(c, SelectionSource.MANUAL);
        return "Recorded " + c.key();
    }

    private String save(String arg) {
        int kinds = EntityKind.values().length;
        String[] parts = arg.isEmpty() ? new String[0] : arg.split("\\s+", kinds + 1);
        if (parts.length != kinds + 1) throw new IllegalArgumentException("save needs " + kinds + " ids and a name");
        CustomCombo combo = engine.saveCombo(parts[kinds], candidate(parts));
        return "Saved " + combo.name + " as " + combo.id;
    }

    private String combo(String idOrName) {
        if (idOrName.isEmpty()) throw new IllegalArgumentException("combo needs an id or name");
        return "Recorded " + engine.selectCombo(idOrName);
    }

    private String combos() {
        List<CustomCombo> all = engine.combos().all();
        if (all.isEmpty()) return "No custom combos.";
        StringBuilder sb = new StringBuilder();
        for (CustomCombo c : all) {
            if (sb.length() > 0) sb.append(System.lineSeparator());
            sb.append(String.format(Locale.ROOT, "%4d  %s  %s  %s", c.usageCount, c.id, c.name, c.candidate.key()));
        }
        return sb.toString();
    }

    private Candidate candidate(String[] ids) {
        Candidate.Builder b = Candidate.builder();
        EntityKind[] kinds = EntityKind.values();
        for (int i = 0; i < kinds.length; i++) {
            if (EMPTY_SLOT.equals(ids[i])) continue;
            EntityRef ref = new EntityRef(kinds[i], ids[i]);
            if (!engine.catalog().contains(ref)) throw new IllegalArgumentException("Unknown catalog entity: " + ref);
            b.with(ref);
        }
        return b.build();
    }

    private String persona(String id) {
        if (id.isEmpty()) throw new IllegalArgumentException("persona needs an id");
        Candidate c = engine.selectPersona(id);
        return "Recorded " + c;
    }

    private String fav(String arg) {
        String[] parts = arg.isEmpty() ? new String[0] : arg.split("\\s+");
        if (parts.length != 2) throw new IllegalArgumentException("fav needs <kind> <id>");
        EntityRef ref = new EntityRef(EntityKind.fromStorageName(parts[0]), parts[1]);
        boolean on = engine.toggleFavorite(ref);
        return (on ? "Starred " : "Unstarred ") + ref;
    }

    private String top() {
        List<CombinationCount> rows = engine.ledger().topCombinations(TOP_LIMIT);
        if (rows.isEmpty()) return "No usage yet.";
        StringBuilder sb = new StringBuilder();
        for (CombinationCount r : rows) {
            if (sb.length() > 0) sb.append(System.lineSeparator());
            sb.append(String.format(Locale.ROOT, "%4d  %s", r.count, r.key));
        }
        return sb.toString();
    }

    private String stats() {
        UsageStats s = engine.stats();
        StringBuilder sb = new StringBuilder();
        sb.append("total=").append(s.totalUsage).append(", combinations=").append(s.uniqueCombinations);
        for (EntityKind k : EntityKind.values()) {
            sb.append(System.lineSeparator()).append("  ").append(k.label()).append(": ")
                    .append(s.topEntity(k).map(r -> r.id).orElse(EMPTY_SLOT));
        }
        return sb.toString();
    }
}
