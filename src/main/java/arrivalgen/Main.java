package arrivalgen;

import java.io.FileInputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;

import com.google.gson.*;

import jevents.model.*;
import jevents.model.Process;

public class Main
{
	public static void main(String[] args) throws Throwable
	{
		if(args.length < 1)
		{
			System.err.println("Usage: arrivalgen <config.json>");
			System.exit(1);
		}
		
		Config config;
		try
		{
			config = readConfig(args[0]);
		}
		catch(ConfigException e)
		{
			System.err.println("Configuration error: " + e.getMessage());
			System.exit(1);
			return;
		}
		
		// Create random seed
		if(config.randomSeed == null)
			config.randomSeed = (int)(new Date()).getTime();
		System.err.println("Random seed: " + config.randomSeed);
		
		List<Process> processes;
		try
		{
			processes = new ProcessFactory(config.randomSeed).createAll(config.processes);
		}
		catch(ConfigException e)
		{
			System.err.println("Configuration error: " + e.getMessage());
			System.exit(1);
			return;
		}
		
		// Write parameters file as read, including the seed actually used
		PrintStream paramsStream = Util.openBufferedPrintStream(Util.outputFilename("parameters_out", "json", config.runNum));
		new GsonBuilder().setPrettyPrinting().create().toJson(config, paramsStream);
		paramsStream.println();
		paramsStream.close();
		
		EventStream stream = new EventStream(processes);
		stream.addLogger(new TextLogger(config));
		if(config.writeSummary)
			stream.addLogger(new SummaryLogger(config));
		
		System.err.println("Start date: " + new Date());
		List<Event> events = stream.run();
		System.err.println("Generated " + events.size() + " events from " + processes.size() + " processes");
		System.err.println("End date: " + new Date());
	}
	
	static Config readConfig(String filename) throws ConfigException
	{
		try(Reader r = new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8))
		{
			return parseConfig(r);
		}
		catch(java.io.IOException e)
		{
			throw new ConfigException("Could not read " + filename, e);
		}
	}
	
	static Config parseConfig(Reader r) throws ConfigException
	{
		Config config;
		try
		{
			config = (new Gson()).fromJson(r, Config.class);
		}
		catch(JsonParseException e)
		{
			throw new ConfigException("Malformed configuration: " + e.getMessage(), e);
		}
		if(config == null)
			throw new ConfigException("Empty configuration");
		return config;
	}
}
