package org.gritvm.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;
import org.gritvm.cli.CommandLineInterface;
import org.gritvm.runtime.MachineOptions;
import org.gritvm.runtime.MachineStatus;
import org.gritvm.runtime.VirtualMachine;
import org.gritvm.runtime.api.ProgramSourceException;
import org.gritvm.runtime.services.MachineInspector;
import org.gritvm.runtime.services.MachineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Loads a program, runs it and prints its output and final status.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_HALTED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_UNREADABLE = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The program file.")
    private File file;

    @Option(names = {"-m", "--memory"}, split = ",", description = "Initial data memory, e.g. '1,2,3'.")
    private List<Long> memory = new ArrayList<>();

    @Option(names = "--max-steps", description = "Maximum number of instructions to execute (0 = unlimited). Overrides the configuration.")
    private Long maxSteps;

    @Option(names = "--dump", description = "Print accumulator, data memory and program after the run.")
    private boolean dump;

    @Option(names = "--json", description = "Print the final machine state as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        MachineOptions options = resolveOptions();

        VirtualMachine vm = new VirtualMachine(options, value -> {
            out.println(value);
            out.flush();
        });

        MachineStatus loaded;
        try {
            loaded = vm.load(file.toPath(), memory);
        } catch (ProgramSourceException e) {
            LOG.debug("Program source unavailable", e);
            err.println(e.getMessage());
            return EXIT_UNREADABLE;
        }

        MachineStatus result = loaded == MachineStatus.READY ? vm.run() : loaded;
        if (!result.isTerminal()) {
            err.println("Program contains no instructions: " + file);
        }

        MachineInspector inspector = new MachineInspector();
        MachineSnapshot snapshot = inspector.snapshot(vm);
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(snapshot));
        } else if (dump) {
            out.print(inspector.render(snapshot, true, true));
        } else {
            out.println("Status: " + result);
            vm.getFailureReason().ifPresent(reason -> out.println("Failure: " + reason));
        }
        out.flush();

        return result == MachineStatus.HALTED ? EXIT_HALTED : EXIT_FAILED;
    }

    private MachineOptions resolveOptions() {
        MachineOptions options;
        try {
            options = parent != null ? MachineOptions.fromConfig(parent.getConfig()) : MachineOptions.defaults();
        } catch (ConfigException e) {
            LOG.debug("Configuration rejected", e);
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
        if (maxSteps != null) {
            if (maxSteps < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "--max-steps must not be negative, was " + maxSteps);
            }
            options = options.withMaxSteps(maxSteps);
        }
        return options;
    }
}
