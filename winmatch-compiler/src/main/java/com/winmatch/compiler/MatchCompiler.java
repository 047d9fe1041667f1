package com.winmatch.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.winmatch.api.exceptions.CompilationException;
import com.winmatch.api.exceptions.PatternException;
import com.winmatch.api.model.MatchDiscipline;
import com.winmatch.compiler.model.MatchDefinition;
import com.winmatch.infra.config.MatchConfig;
import com.winmatch.runtime.match.WindowCondition;
import com.winmatch.runtime.match.WindowGroup;
import com.winmatch.runtime.match.WindowMatch;
import com.winmatch.runtime.pattern.PatternCache;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns JSON match definitions into predicate trees, and trees back into JSON.
 *
 * <p>Example definition:
 * <pre>{@code
 * {
 *   "type": "any_of",
 *   "whitelist": [
 *     { "title": "Notepad", "discipline": "PARTIAL" },
 *     { "exe": "^code$" }
 *   ],
 *   "blacklist": [ { "class_name": "ConsoleWindowClass", "discipline": "FULL" } ]
 * }
 * }</pre>
 *
 * Conditions without a {@code discipline} use the configured default.
 * Writing a compiled tree and compiling the output yields an equal tree.
 */
public class MatchCompiler {
    private static final Logger logger = Logger.getLogger(MatchCompiler.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Tracer tracer;
    private final MatchDiscipline defaultDiscipline;
    private final PatternCache patternCache;

    public MatchCompiler(Tracer tracer) {
        this(tracer, MatchConfig.fromEnvironment(), PatternCache.shared());
    }

    public MatchCompiler(Tracer tracer, MatchConfig config) {
        this(tracer, config, new PatternCache(config));
    }

    public MatchCompiler(Tracer tracer, MatchConfig config, PatternCache patternCache) {
        this.tracer = tracer;
        this.defaultDiscipline = config.getDefaultDiscipline();
        this.patternCache = patternCache;
    }

    // ========================================================================
    // JSON -> TREE
    // ========================================================================

    /**
     * Compiles the definition stored in a JSON file.
     *
     * @throws IOException          if the file cannot be read
     * @throws CompilationException if the JSON is malformed or describes an invalid tree
     */
    public WindowMatch compile(Path definitionPath) throws IOException, CompilationException {
        Span span = tracer.spanBuilder("compile-match-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("definitionPath", definitionPath.toString());
            return compile(Files.readString(definitionPath));
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public WindowMatch compile(String json) throws CompilationException {
        MatchDefinition definition;
        try {
            definition = objectMapper.readValue(json, MatchDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Unreadable match definition: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new CompilationException("Match definition is empty");
        }
        return compile(definition);
    }

    public WindowMatch compile(MatchDefinition definition) throws CompilationException {
        Span span = tracer.spanBuilder("compile-match").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            Counts counts = new Counts();

            WindowMatch match = compileNode(definition, "$", counts);

            span.setAttribute("conditionCount", counts.conditions);
            span.setAttribute("groupCount", counts.groups);
            logger.fine(String.format("Compiled match definition: %d conditions, %d groups in %d us",
                    counts.conditions, counts.groups, (System.nanoTime() - startTime) / 1_000));
            return match;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private WindowMatch compileNode(MatchDefinition def, String path, Counts counts) {
        if (def == null) {
            throw new CompilationException(path + ": entry cannot be null");
        }

        return switch (def.type()) {
            case MatchDefinition.TYPE_CONDITION -> compileCondition(def, path, counts);
            case MatchDefinition.TYPE_ANY_OF -> compileGroup(def, WindowGroup.Combinator.ANY_OF, path, counts);
            case MatchDefinition.TYPE_ALL_OF -> compileGroup(def, WindowGroup.Combinator.ALL_OF, path, counts);
            default -> throw new CompilationException(path + ": unknown type '" + def.type() + "'");
        };
    }

    private WindowCondition compileCondition(MatchDefinition def, String path, Counts counts) {
        if (def.whitelist() != null || def.blacklist() != null) {
            throw new CompilationException(path + ": a condition cannot have a whitelist or blacklist");
        }

        MatchDiscipline discipline = defaultDiscipline;
        if (def.discipline() != null) {
            discipline = MatchDiscipline.fromString(def.discipline());
            if (discipline == null) {
                throw new CompilationException(path + ": unknown discipline '" + def.discipline() + "'");
            }
        }

        try {
            WindowCondition condition = WindowCondition.builder()
                    .handle(def.handle())
                    .title(def.title())
                    .className(def.className())
                    .executableName(def.exe())
                    .executablePath(def.exePath())
                    .processId(def.pid() != null ? def.pid() : 0L)
                    .discipline(discipline)
                    .reverse(def.reverse())
                    .patternCache(patternCache)
                    .build();
            counts.conditions++;
            return condition;
        } catch (PatternException | IllegalArgumentException e) {
            throw new CompilationException(path + ": " + e.getMessage(), e);
        }
    }

    private WindowGroup compileGroup(MatchDefinition def, WindowGroup.Combinator combinator,
                                     String path, Counts counts) {
        if (def.hasCriteria()) {
            throw new CompilationException(path + ": a group cannot carry condition criteria");
        }

        WindowGroup group = new WindowGroup(combinator);
        group.setReverse(def.reverse());

        List<MatchDefinition> whitelist = def.whitelist() != null ? def.whitelist() : List.of();
        for (int i = 0; i < whitelist.size(); i++) {
            group.add(compileNode(whitelist.get(i), path + ".whitelist[" + i + "]", counts));
        }
        List<MatchDefinition> blacklist = def.blacklist() != null ? def.blacklist() : List.of();
        for (int i = 0; i < blacklist.size(); i++) {
            group.addBlacklist(compileNode(blacklist.get(i), path + ".blacklist[" + i + "]", counts));
        }

        counts.groups++;
        return group;
    }

    // ========================================================================
    // TREE -> JSON
    // ========================================================================

    public MatchDefinition toDefinition(WindowMatch match) {
        if (match instanceof WindowCondition condition) {
            return MatchDefinition.condition(
                    condition.getHandle(),
                    condition.getTitle(),
                    condition.getClassName(),
                    condition.getExecutableName(),
                    condition.getExecutablePath(),
                    condition.getProcessId() != 0 ? condition.getProcessId() : null,
                    condition.getDiscipline().name(),
                    condition.isReverse() ? Boolean.TRUE : null);
        }

        WindowGroup group = (WindowGroup) match;
        String type = group.getCombinator() == WindowGroup.Combinator.ANY_OF
                ? MatchDefinition.TYPE_ANY_OF
                : MatchDefinition.TYPE_ALL_OF;
        return MatchDefinition.group(type,
                group.isReverse() ? Boolean.TRUE : null,
                toDefinitions(group.whitelist()),
                toDefinitions(group.blacklist()));
    }

    private List<MatchDefinition> toDefinitions(List<WindowMatch> matches) {
        List<MatchDefinition> definitions = new ArrayList<>(matches.size());
        for (WindowMatch match : matches) {
            definitions.add(toDefinition(match));
        }
        return definitions;
    }

    public String write(WindowMatch match) {
        try {
            return objectMapper.writeValueAsString(toDefinition(match));
        } catch (JsonProcessingException e) {
            throw new CompilationException("Cannot serialize match: " + match, e);
        }
    }

    public void write(WindowMatch match, Path target) throws IOException {
        Files.writeString(target, write(match));
        logger.info("Wrote match definition to " + target);
    }

    private static final class Counts {
        int conditions;
        int groups;
    }
}
