package arrivalgen;

import java.util.*;

import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

import jevents.model.*;
import jevents.model.Process;

/**
 * Builds processes from configuration. Every stochastic process gets its
 * own engine. Engine seeds are drawn in order from a Mersenne Twister
 * seeded with the master seed, so runs with nearby master seeds share no
 * process streams.
 */
public class ProcessFactory {
    private final RandomEngine seeds;

    public ProcessFactory(int randomSeed) {
        seeds = new MersenneTwister(randomSeed);
    }

    public List<Process> createAll(List<ProcessConfig> configs) throws ConfigException {
        if (configs == null || configs.isEmpty())
            throw new ConfigException("No processes configured");

        List<Process> processes = new ArrayList<Process>(configs.size());
        Set<String> names = new HashSet<String>();
        for (int i = 0; i < configs.size(); i++) {
            Process process = create(i, configs.get(i));
            if (!names.add(process.getName()))
                throw new ConfigException(String.format("processes[%d]: duplicate name %s", i, process.getName()));
            processes.add(process);
        }
        return processes;
    }

    Process create(int index, ProcessConfig pc) throws ConfigException {
        if (pc == null)
            throw new ConfigException(String.format("processes[%d]: empty entry", index));
        if (pc.type == null)
            throw new ConfigException(String.format("processes[%d]: missing or unknown type", index));
        String name = require(index, "name", pc.name);

        try {
            switch (pc.type) {
                case Singleton:
                    return new SingletonProcess(name,
                            require(index, "duration", pc.duration),
                            require(index, "arrival", pc.arrival));
                case Periodic:
                    return new PeriodicProcess(name,
                            require(index, "duration", pc.duration),
                            require(index, "interarrivalTime", pc.interarrivalTime),
                            require(index, "firstArrival", pc.firstArrival),
                            require(index, "numRepetitions", pc.numRepetitions));
                case Stochastic:
                    return new StochasticProcess(name,
                            require(index, "meanDuration", pc.meanDuration),
                            require(index, "meanInterarrivalTime", pc.meanInterarrivalTime),
                            require(index, "firstArrival", pc.firstArrival),
                            require(index, "endTime", pc.endTime),
                            new MersenneTwister(seeds.nextInt()));
            }
        } catch (InvalidParameterException e) {
            throw new ConfigException(String.format("processes[%d] (%s): %s", index, name, e.getMessage()), e);
        }
        throw new ConfigException(String.format("processes[%d]: unsupported type %s", index, pc.type));
    }

    private static <T> T require(int index, String field, T value) throws ConfigException {
        if (value == null)
            throw new ConfigException(String.format("processes[%d]: missing %s", index, field));
        return value;
    }
}
