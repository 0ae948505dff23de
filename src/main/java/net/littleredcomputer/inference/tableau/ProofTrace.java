package net.littleredcomputer.inference.tableau;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the indented account of a search. Disabled traces record nothing, but still
 * echo to the log at TRACE level.
 */
final class ProofTrace {
    private static final Logger log = LogManager.getFormatterLogger(ProofTrace.class);
    private static final Joiner lineJoiner = Joiner.on('\n');
    private final boolean enabled;
    private final List<String> lines = new ArrayList<>();

    ProofTrace(boolean enabled) {
        this.enabled = enabled;
    }

    void line(Object data, int depth) {
        line(data, depth, 0);
    }

    void line(Object data, int depth, int extraIndent) {
        if (!enabled && !log.isTraceEnabled()) return;
        String text = Strings.repeat("   ", depth + extraIndent) + data;
        if (enabled) lines.add(text);
        log.trace("%s", text);
    }

    String text() {
        return lineJoiner.join(lines);
    }
}
