package arrivalgen;

import com.google.gson.annotations.SerializedName;

/**
 * One entry of the "processes" list. Which fields are required depends
 * on the type.
 */
public class ProcessConfig {
    enum Type {
        @SerializedName("singleton")
        Singleton,
        @SerializedName("periodic")
        Periodic,
        @SerializedName("stochastic")
        Stochastic
    }

    Type type;
    String name;

    // singleton, periodic
    Integer duration;

    // singleton
    Integer arrival;

    // periodic
    Integer interarrivalTime;
    Integer numRepetitions;

    // periodic, stochastic
    Integer firstArrival;

    // stochastic
    Double meanDuration;
    Double meanInterarrivalTime;
    Integer endTime;
}
