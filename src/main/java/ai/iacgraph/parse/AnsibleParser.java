package ai.iacgraph.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.parse.yaml.YamlDocument;
import ai.iacgraph.scan.SourceFile;

/**
 * Reads playbooks: a list of plays, each with {@code vars}, task sections and handlers.
 * <p>
 * Blocks get the scope {@code play-<n>:<section>}; the play header is kept as an extension keyed
 * {@code <file>#<n>}.
 */
public final class AnsibleParser extends YamlDialectParser {

    public static final List<String> TASK_SECTIONS = List.of("pre_tasks", "tasks", "post_tasks", "handlers");

    /**
     * Task-level keywords; any other key of a task is its module.
     */
    public static final Set<String> TASK_KEYWORDS = Set.of(
            "name", "when", "become", "become_user", "become_method", "notify", "listen", "loop",
            "loop_control", "with_items", "with_dict", "with_list", "with_fileglob", "with_together",
            "tags", "register", "ignore_errors", "changed_when", "failed_when", "delegate_to", "run_once",
            "vars", "environment", "args", "async", "poll", "retries", "delay", "until", "no_log",
            "check_mode", "diff", "any_errors_fatal", "timeout", "throttle", "collections",
            "module_defaults", "debugger", "connection", "remote_user", "port", "rescue", "always");

    public AnsibleParser() {
        super(false);
    }

    @Override
    public Dialect dialect() {
        return Dialect.ANSIBLE;
    }

    @Override
    void readDocument(SourceFile file, YamlDocument doc, List<SourceBlock> blocks, List<ParseError> errors) {
        if (!(doc.root() instanceof List<?> plays)) {
            errors.add(new ParseError(file.path(), doc.line(), null, "playbook root is not a list of plays"));
            return;
        }
        for (int p = 0; p < plays.size(); p++) {
            final Object raw = plays.get(p);
            final Map<String, Object> play = asMap(raw);
            if (play == null) {
                errors.add(new ParseError(file.path(), doc.lineOf(raw, doc.line()), null, "play is not a mapping"));
                continue;
            }
            final String scope = "play-" + p;
            final Map<String, Object> header = new LinkedHashMap<>();
            for (var e : play.entrySet()) {
                if (!TASK_SECTIONS.contains(e.getKey()) && !e.getKey().equals("vars")) {
                    header.put(e.getKey(), e.getValue());
                }
            }
            blocks.add(new SourceBlock(BlockKind.EXTENSION, "play", file.path() + "#" + p, header, Set.of(),
                    scope, at(file, doc, play)));

            final Map<String, Object> vars = asMap(play.get("vars"));
            if (vars != null) {
                for (var e : vars.entrySet()) {
                    final Map<String, Object> body = new LinkedHashMap<>();
                    body.put("value", e.getValue());
                    blocks.add(new SourceBlock(BlockKind.VARIABLE, "var", e.getKey(), body, Set.of(), scope,
                            at(file, doc, vars)));
                }
            } else if (play.get("vars") != null) {
                errors.add(new ParseError(file.path(), doc.lineOf(play, doc.line()), scope, "play vars is not a mapping"));
            }

            for (String section : TASK_SECTIONS) {
                final Object list = play.get(section);
                if (list == null) {
                    continue;
                }
                if (!(list instanceof List<?> tasks)) {
                    errors.add(new ParseError(file.path(), doc.lineOf(play, doc.line()), scope, section + " is not a list"));
                    continue;
                }
                for (Object t : tasks) {
                    task(file, doc, scope + ":" + section, section.equals("handlers"), t, blocks, errors);
                }
            }
        }
    }

    private static void task(SourceFile file, YamlDocument doc, String scope, boolean handler, Object raw,
                             List<SourceBlock> blocks, List<ParseError> errors) {
        final Map<String, Object> task = asMap(raw);
        final int line = doc.lineOf(raw, doc.line());
        if (task == null) {
            errors.add(new ParseError(file.path(), line, null, "task is not a mapping"));
            return;
        }
        final String name = text(task.get("name"));
        final String module = moduleOf(task);
        if (module == null) {
            errors.add(new ParseError(file.path(), line, name, "task has no module"));
            return;
        }
        blocks.add(new SourceBlock(handler ? BlockKind.HANDLER : BlockKind.TASK, module, name, task, Set.of(),
                scope, at(file, doc, raw)));
    }

    /**
     * First key that is not a task keyword; {@code block} for block tasks.
     */
    public static String moduleOf(Map<String, Object> task) {
        for (String key : task.keySet()) {
            if (!TASK_KEYWORDS.contains(key)) {
                return key;
            }
        }
        return null;
    }
}
