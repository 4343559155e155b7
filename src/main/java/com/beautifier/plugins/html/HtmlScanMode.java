package com.beautifier.plugins.html;

/**
 * Mutually exclusive scanner modes of {@link HtmlLayoutEngine}.
 * <pre>
 * TEXT      --'&lt;'----------------&gt; TAG
 * TAG       --'"' or '\''---------&gt; TAG_QUOTE
 * TAG       --content is "!--"----&gt; COMMENT
 * TAG       --'&gt;'----------------&gt; TEXT   (tag emitted)
 * TAG_QUOTE --matching quote------&gt; TAG
 * COMMENT   --"--&gt;"--------------&gt; TEXT   (comment emitted)
 * </pre>
 */
public enum HtmlScanMode {
    TEXT,
    TAG,
    TAG_QUOTE,
    COMMENT
}
