package utilities;

import automaton.Automaton;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

public class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    // JOL report for an automaton: VM details, retained size, optionally the class footprint table.
    public String jolMemoryReport(boolean includeFootprintTable, Automaton automaton) {
        StringBuilder sb = new StringBuilder(4_096);

        // Alignment, header sizes and compressed oops affect every number below.
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(automaton);
        sb.append("\n=== Automaton total ===\n");
        sb.append("States            : ").append(automaton.stateCount()).append('\n');
        sb.append("Transitions       : ").append(automaton.transitionCount()).append('\n');
        sb.append("Genes             : ").append(automaton.geneCount()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / MIB))
                .append(" MiB\n");
        if (automaton.stateCount() > 0) {
            sb.append("Bytes per state   : ")
                    .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) automaton.stateCount()))
                    .append('\n');
        }

        if (includeFootprintTable) {
            // Per-class histogram; the edge maps usually dominate.
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }
}
