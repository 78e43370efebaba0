package arrivalgen;

import java.util.ArrayList;
import java.util.List;

public class Config {
    Integer randomSeed = null;

    // Selects events.N.csv / summary.N.csv as output files
    Integer runNum = null;

    boolean writeSummary = true;

    List<ProcessConfig> processes = new ArrayList<ProcessConfig>();
}
