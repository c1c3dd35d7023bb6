package org.learningjava.reorderfields.infrastructure.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase.RewriteResult;
import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.plan.DesiredOrder;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;
import org.learningjava.reorderfields.infrastructure.adapter.in.web.ReorderReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code --record-name=<name> --fields-order=<a,b,c> [-i|--in-place] [--format=text|json] <paths...>}.
 * Inert unless {@code --record-name} is given.
 */
@Component
public class ReorderFieldsCommand implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReorderFieldsCommand.class);

    static final String RECORD_NAME = "record-name";
    static final String FIELDS_ORDER = "fields-order";
    static final String IN_PLACE = "in-place";
    static final String FORMAT = "format";

    private final RewriteSourcesUseCase useCase;
    private final ObjectMapper mapper;
    private final PrintStream out;

    @Autowired
    public ReorderFieldsCommand(RewriteSourcesUseCase useCase, ObjectMapper mapper) {
        this(useCase, mapper, System.out);
    }

    ReorderFieldsCommand(RewriteSourcesUseCase useCase, ObjectMapper mapper, PrintStream out) {
        this.useCase = useCase;
        this.mapper = mapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption(RECORD_NAME)) {
            return;
        }
        String recordName = single(args, RECORD_NAME);
        List<String> order = DesiredOrder.parse(args.containsOption(FIELDS_ORDER) ? single(args, FIELDS_ORDER) : "")
                .names();
        boolean inPlace = args.containsOption(IN_PLACE) || args.getNonOptionArgs().contains("-i");
        String format = args.containsOption(FORMAT) ? single(args, FORMAT) : "text";
        if (!format.equals("text") && !format.equals("json")) {
            throw new IllegalArgumentException("Unknown format: " + format + " (expected text or json)");
        }
        List<Path> paths = args.getNonOptionArgs().stream()
                .filter(a -> !a.equals("-i"))
                .map(Path::of)
                .toList();
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No source files given");
        }

        RewriteResult result = useCase.rewriteFiles(recordName, order, paths, inPlace);
        ReorderOutcome outcome = result.outcome();
        for (InitializationOrderWarning w : outcome.warnings()) {
            log.warn("{}: {}", w.location(), w.message());
        }

        if (format.equals("json")) {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(ReorderReport.from(result)));
        } else if (!inPlace) {
            Map<String, String> sorted = new TreeMap<>(result.rewritten());
            sorted.forEach((path, content) -> {
                if (sorted.size() > 1) {
                    out.println("==> " + path + " <==");
                }
                out.print(content);
            });
        }

        if (outcome.isFailed()) {
            throw new IllegalStateException(outcome.error().message());
        }
        if (outcome.unsafeSyntax() != null) {
            log.warn("{} cannot be reordered safely ({}), nothing changed", recordName, outcome.unsafeSyntax());
        }
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one --" + option + "=<value>");
        }
        return values.get(0);
    }
}
