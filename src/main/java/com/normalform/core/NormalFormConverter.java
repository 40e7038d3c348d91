package com.normalform.core;

import com.normalform.config.NormalFormConfig;
import com.normalform.exception.InvalidSentenceException;
import com.normalform.format.ClauseOrder;
import com.normalform.format.PredicateFormatter;
import com.normalform.minimizer.CoverMinimizer;
import com.normalform.minimizer.NormalForm;
import com.normalform.minimizer.Predicate;
import com.normalform.sentence.PostfixConverter;
import com.normalform.sentence.SentenceTokenizer;
import com.normalform.sentence.SentenceValidator;
import com.normalform.sentence.TermExtractor;
import com.normalform.sentence.Token;
import com.normalform.truthtable.SentenceEvaluator;
import com.normalform.truthtable.TermEncoder;
import com.normalform.truthtable.TermTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Converts propositional sentences into simplified CNF or DNF.
 * <p>
 * Pipeline: tokenize, validate, extract terms, encode terms, convert to postfix,
 * evaluate the sentence mask, minimize, order clauses, render.
 * Each conversion is independent; the converter holds only its configuration.
 * <p>
 * Cost grows as 2^n in the number of distinct terms n, so sentences over the
 * configured {@code max-terms} are rejected.
 */
public class NormalFormConverter {

    private static final Logger log = LoggerFactory.getLogger(NormalFormConverter.class);

    private final NormalFormConfig config;

    public NormalFormConverter() {
        this(NormalFormConfig.defaults());
    }

    public NormalFormConverter(NormalFormConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public NormalFormConfig getConfig() {
        return config;
    }

    /**
     * Convert a sentence and return only the rendered predicate.
     *
     * @param sentence Sentence over {@code && || ~ ( ) =>}
     * @param form     Target normal form
     * @return Rendered predicate, or {@code true} / {@code false}
     * @throws InvalidSentenceException if the sentence is not well formed
     */
    public String toNormalForm(String sentence, NormalForm form) {
        return convert(sentence, form).text();
    }

    /**
     * Convert a sentence.
     *
     * @param sentence Sentence over {@code && || ~ ( ) =>}
     * @param form     Target normal form, or null for the configured default
     * @return Conversion result
     * @throws InvalidSentenceException if the sentence is not well formed or has too many terms
     */
    public ConversionResult convert(String sentence, NormalForm form) {
        NormalForm target = form != null ? form : config.defaultForm();

        SentenceTokenizer tokenizer = new SentenceTokenizer(sentence);
        List<Token> tokens = tokenizer.tokenize();
        log.debug("Tokenized '{}' into {} tokens", tokenizer.input(), tokens.size());

        if (!SentenceValidator.isValid(tokens)) {
            throw new InvalidSentenceException(sentence, "Invalid sentence: '" + sentence + "'");
        }

        List<String> termNames = TermExtractor.extract(tokens);
        if (termNames.size() > config.maxTerms()) {
            throw new InvalidSentenceException(sentence, "Sentence has " + termNames.size()
                    + " distinct terms, the limit is " + config.maxTerms());
        }
        if (termNames.size() > config.warnTerms()) {
            log.warn("Sentence has {} distinct terms; conversion cost grows as 2^n", termNames.size());
        }

        TermTable terms = TermEncoder.encode(termNames);
        List<Token> postfix = PostfixConverter.toPostfix(tokens);
        BigInteger sentenceMask = SentenceEvaluator.evaluate(postfix, terms);
        log.debug("Sentence over {} has {} true rows of {}",
                termNames, sentenceMask.bitCount(), terms.rowCount());

        Predicate predicate = ClauseOrder.canonicalize(CoverMinimizer.minimize(sentenceMask, terms, target));
        String text = PredicateFormatter.format(predicate);
        log.debug("{} of '{}': {}", target, sentence, text);

        return new ConversionResult(sentence, target, termNames, sentenceMask, predicate, text);
    }
}
