package com.autosort.oracle;

import com.autosort.models.OracleKind;
import com.autosort.models.PromptContext;

import java.io.IOException;

/**
 * A path-suggestion service. Implementations handle the transport for one provider kind and
 * return the raw response text untouched; callers parse it.
 */
public interface Oracle {

    OracleKind getKind();

    /**
     * Ask for a destination folder for the described file.
     *
     * @return raw response text, possibly prose, markup or an error marker
     */
    String suggest(PromptContext context) throws IOException, InterruptedException;

    /**
     * Ask the oracle to improve {@code candidate} only where it conflicts with the existing taxonomy.
     */
    String refine(PromptContext context, String candidate) throws IOException, InterruptedException;
}
