package arrivalgen;

import java.io.PrintStream;
import java.util.List;

import jevents.logging.*;
import jevents.model.Event;
import jevents.model.Process;

/**
 * Writes the merged event stream as CSV, one row per event.
 */
public class TextLogger implements EventLogger {
    private PrintStream stream;
    private final String filename;

    long eventCount = 0;

    public TextLogger(Config config) {
        this(Util.outputFilename("events", "csv", config.runNum));
    }

    public TextLogger(String filename) {
        this.filename = filename;
    }

    TextLogger(PrintStream stream) {
        this.filename = null;
        this.stream = stream;
    }

    public void logStart(List<? extends Process> processes) throws LoggingException {
        try {
            if (stream == null)
                stream = Util.openBufferedPrintStream(filename);
            stream.printf("process,arrival,duration\n");
        } catch (Exception e) {
            throw new LoggingException(this, e);
        }
    }

    public void logEvent(Event event) throws LoggingException {
        stream.printf("%s,%d,%d\n", event.getProcessName(), event.getArrivalTime(), event.getDuration());
        eventCount++;
    }

    public void logEnd() throws LoggingException {
        stream.flush();
        if (filename != null)
            stream.close();
        if (stream.checkError())
            throw new LoggingException(this, "Error writing " + (filename == null ? "events" : filename));
    }

    public long getEventCount() {
        return eventCount;
    }
}
