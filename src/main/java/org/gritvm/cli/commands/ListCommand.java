package org.gritvm.cli.commands;

import org.gritvm.runtime.isa.DecodedProgram;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionDecoder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", description = "Decodes a program and prints its instruction listing.")
public class ListCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The program file.")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<String> lines;
        try {
            lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Unable to read program file: " + file);
            return RunCommand.EXIT_UNREADABLE;
        }

        DecodedProgram program = new InstructionDecoder().decodeProgram(lines);
        if (!program.isSuccessful()) {
            err.println("Decode failure at " + program.failure());
            return RunCommand.EXIT_FAILED;
        }

        List<Instruction> instructions = program.instructions();
        for (int i = 0; i < instructions.size(); i++) {
            out.println("Instruction " + i + ": " + instructions.get(i));
        }
        out.flush();
        return 0;
    }
}
