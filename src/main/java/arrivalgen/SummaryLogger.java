package arrivalgen;

import java.io.PrintStream;
import java.util.*;

import jevents.logging.*;
import jevents.model.Event;
import jevents.model.Process;
import static arrivalgen.Util.*;

/**
 * Writes per-process statistics of the generated events as CSV. Columns
 * that are undefined for a process (no events, or fewer than two arrivals
 * for the interarrival mean) are left empty.
 */
public class SummaryLogger implements EventLogger {
    private PrintStream stream;
    private final String filename;

    private Map<String, List<Integer>> durations;
    private Map<String, List<Integer>> arrivals;

    public SummaryLogger(Config config) {
        this(outputFilename("summary", "csv", config.runNum));
    }

    public SummaryLogger(String filename) {
        this.filename = filename;
    }

    SummaryLogger(PrintStream stream) {
        this.filename = null;
        this.stream = stream;
    }

    public void logStart(List<? extends Process> processes) throws LoggingException {
        durations = new LinkedHashMap<String, List<Integer>>();
        arrivals = new LinkedHashMap<String, List<Integer>>();
        for (Process process : processes) {
            durations.put(process.getName(), new ArrayList<Integer>());
            arrivals.put(process.getName(), new ArrayList<Integer>());
        }

        try {
            if (stream == null)
                stream = openBufferedPrintStream(filename);
            stream.printf("process,count,duration_mean,duration_sd,interarrival_mean,first_arrival,last_arrival\n");
        } catch (Exception e) {
            throw new LoggingException(this, e);
        }
    }

    public void logEvent(Event event) throws LoggingException {
        List<Integer> d = durations.get(event.getProcessName());
        if (d == null)
            throw new LoggingException(this, "Event from unknown process " + event.getProcessName());
        d.add(event.getDuration());
        arrivals.get(event.getProcessName()).add(event.getArrivalTime());
    }

    public void logEnd() throws LoggingException {
        for (String name : durations.keySet()) {
            double[] d = toArray(durations.get(name));
            List<Integer> a = arrivals.get(name);

            if (d.length == 0) {
                stream.printf("%s,0,,,,,\n", name);
                continue;
            }

            int first = a.get(0);
            int last = a.get(a.size() - 1);
            double interarrivalMean = a.size() < 2 ? Double.NaN : (last - first) / (double)(a.size() - 1);

            stream.printf("%s,%d,%s,%s,%s,%d,%d\n",
                    name, d.length,
                    formatNumber(mean(d)), formatNumber(sd(d)),
                    formatNumber(interarrivalMean),
                    first, last
            );
        }

        stream.flush();
        if (filename != null)
            stream.close();
        if (stream.checkError())
            throw new LoggingException(this, "Error writing " + (filename == null ? "summary" : filename));
    }
}
