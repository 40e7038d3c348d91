package com.normalform.config;

import com.normalform.exception.ConfigurationException;
import com.normalform.minimizer.NormalForm;
import com.normalform.truthtable.Masks;

/**
 * Root configuration for normal form conversion.
 *
 * @param defaultForm  Form used when no mode is given
 * @param maxTerms     Sentences with more distinct terms are rejected
 * @param warnTerms    Sentences with more distinct terms are logged as expensive
 * @param outputFormat Command line output format
 */
public record NormalFormConfig(
        NormalForm defaultForm,
        int maxTerms,
        int warnTerms,
        OutputFormat outputFormat
) {
    public static final int DEFAULT_MAX_TERMS = 16;
    public static final int DEFAULT_WARN_TERMS = 12;

    public NormalFormConfig {
        if (defaultForm == null) {
            defaultForm = NormalForm.CNF;
        }
        if (outputFormat == null) {
            outputFormat = OutputFormat.TEXT;
        }
        if (maxTerms < 1 || maxTerms > Masks.MAX_TERMS) {
            throw new ConfigurationException("max-terms must be between 1 and "
                    + Masks.MAX_TERMS + ", got " + maxTerms);
        }
        if (warnTerms < 0 || warnTerms > maxTerms) {
            throw new ConfigurationException("warn-terms must be between 0 and max-terms ("
                    + maxTerms + "), got " + warnTerms);
        }
    }

    public static NormalFormConfig defaults() {
        return new NormalFormConfig(NormalForm.CNF, DEFAULT_MAX_TERMS, DEFAULT_WARN_TERMS, OutputFormat.TEXT);
    }
}
