package com.normalform.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.normalform.config.OutputFormat;
import com.normalform.core.ConversionResult;
import com.normalform.core.NormalFormConverter;
import com.normalform.exception.InvalidSentenceException;
import com.normalform.exception.NormalFormException;
import com.normalform.minimizer.NormalForm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line front end: {@code normal-form <sentence> [dnf] [--json]}.
 * <p>
 * Exit codes:
 * <ul>
 *   <li>0: converted</li>
 *   <li>1: the sentence is not well formed</li>
 *   <li>2: internal error</li>
 *   <li>64: no sentence given</li>
 * </ul>
 */
public class NormalFormCommand {

    private static final Logger log = LoggerFactory.getLogger(NormalFormCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_SENTENCE = 1;
    public static final int EXIT_INTERNAL_ERROR = 2;
    public static final int EXIT_USAGE = 64;

    public static final String INVALID_SENTENCE_MESSAGE = "Invalid sentence.";
    public static final String USAGE = "Usage: normal-form <sentence> [dnf] [--json]";
    public static final String JSON_FLAG = "--json";

    private static final List<String> PROPERTY_OPTION_PREFIXES =
            List.of("--spring.", "--logging.", "--normal-form.");

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final NormalFormConverter converter;
    private final PrintStream out;
    private final PrintStream err;

    public NormalFormCommand(NormalFormConverter converter, PrintStream out, PrintStream err) {
        this.converter = converter;
        this.out = out;
        this.err = err;
    }

    /**
     * Run one conversion.
     *
     * @param args Sentence, optional mode, optional {@code --json}; other {@code --} options are ignored
     * @return Process exit code
     */
    public int run(String... args) {
        List<String> positional = new ArrayList<>();
        OutputFormat format = converter.getConfig().outputFormat();
        for (String arg : args) {
            if (JSON_FLAG.equals(arg)) {
                format = OutputFormat.JSON;
            } else if (isPropertyOption(arg)) {
                log.debug("Ignoring option {}", arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String sentence = positional.get(0);
        NormalForm form = positional.size() >= 2
                ? NormalForm.fromMode(positional.get(1))
                : converter.getConfig().defaultForm();

        try {
            ConversionResult result = converter.convert(sentence, form);
            out.println(format == OutputFormat.JSON ? toJson(result) : result.text());
            return EXIT_OK;
        } catch (InvalidSentenceException e) {
            log.debug("Rejected sentence: {}", e.getMessage());
            out.println(INVALID_SENTENCE_MESSAGE);
            return EXIT_INVALID_SENTENCE;
        } catch (NormalFormException e) {
            log.error("Conversion failed for '{}'", sentence, e);
            err.println(e.getMessage());
            return EXIT_INTERNAL_ERROR;
        }
    }

    /**
     * Spring Boot property overrides such as {@code --logging.level.root=debug}.
     * Any other argument, including one starting with {@code --}, is positional.
     */
    static boolean isPropertyOption(String arg) {
        for (String prefix : PROPERTY_OPTION_PREFIXES) {
            if (arg.startsWith(prefix) && arg.contains("=")) {
                return true;
            }
        }
        return false;
    }

    static String toJson(ConversionResult result) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("sentence", result.sentence());
        json.put("form", result.form().name());
        json.put("terms", result.terms());
        json.put("result", result.text());
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new NormalFormException("Failed to render result as JSON", e);
        }
    }
}
