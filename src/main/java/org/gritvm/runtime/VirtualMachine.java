package org.gritvm.runtime;

import org.gritvm.runtime.api.ProgramSourceException;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.internal.services.LoggingOutputSink;
import org.gritvm.runtime.isa.DecodedProgram;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionDecoder;
import org.gritvm.runtime.isa.InstructionHandler;
import org.gritvm.runtime.isa.InstructionSet;
import org.gritvm.runtime.model.InstructionStore;
import org.gritvm.runtime.model.MachineState;
import org.gritvm.runtime.spi.IOutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The core of the execution environment.
 * <p>
 * A VirtualMachine owns an accumulator, a resizable data memory and a loaded program. It follows the
 * lifecycle described by {@link MachineStatus}: {@link #load} is only honoured while WAITING,
 * {@link #run} only while READY, and {@link #reset} always. Calls in the wrong state return the
 * current status and change nothing.
 * <p>
 * Once a program is being loaded no exception crosses this class for a program error: decode
 * failures and runtime errors move the machine to {@link MachineStatus#ERRORED} and the reason is
 * available through {@link #getFailureReason()}.
 * <p>
 * Instances are not thread-safe.
 */
public class VirtualMachine {
    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final MachineState state = new MachineState();
    private final InstructionStore instructionStore = new InstructionStore();
    private final InstructionDecoder decoder = new InstructionDecoder();
    private final InstructionSet instructionSet;
    private final MachineOptions options;
    private final ExecutionContext context;
    private long stepCount = 0L;

    /**
     * Creates a machine with the standard instruction set, no step budget and OUTPUT values going
     * to the log.
     */
    public VirtualMachine() {
        this(MachineOptions.defaults(), new LoggingOutputSink());
    }

    public VirtualMachine(IOutputSink outputSink) {
        this(MachineOptions.defaults(), outputSink);
    }

    public VirtualMachine(MachineOptions options, IOutputSink outputSink) {
        this(options, outputSink, InstructionSet.standard());
    }

    /**
     * Creates a machine.
     *
     * @param options The runtime options.
     * @param outputSink The receiver of OUTPUT values.
     * @param instructionSet The instruction families to execute with.
     */
    public VirtualMachine(MachineOptions options, IOutputSink outputSink, InstructionSet instructionSet) {
        this.options = Objects.requireNonNull(options, "options");
        this.instructionSet = Objects.requireNonNull(instructionSet, "instructionSet");
        this.context = new ExecutionContext(state, Objects.requireNonNull(outputSink, "outputSink"));
    }

    /**
     * Reads a program file and loads it. The file is only read if the machine is WAITING.
     *
     * @param programFile The program text file (UTF-8).
     * @param initialMemory The initial data memory. Copied.
     * @return The resulting status.
     * @throws ProgramSourceException if the file cannot be read.
     */
    public MachineStatus load(Path programFile, List<Long> initialMemory) throws ProgramSourceException {
        Objects.requireNonNull(programFile, "programFile");
        if (state.getStatus() != MachineStatus.WAITING) {
            return state.getStatus();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(programFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProgramSourceException("Unable to read program file: " + programFile, e);
        }
        return load(lines, initialMemory);
    }

    /**
     * Decodes program text and loads it together with the initial data memory.
     * <p>
     * Decoding stops at the first malformed line, which moves the machine to ERRORED. An empty
     * program leaves the machine WAITING.
     *
     * @param sourceLines The program text, one instruction per line.
     * @param initialMemory The initial data memory. Copied.
     * @return The resulting status.
     */
    public MachineStatus load(List<String> sourceLines, List<Long> initialMemory) {
        Objects.requireNonNull(sourceLines, "sourceLines");
        Objects.requireNonNull(initialMemory, "initialMemory");
        if (state.getStatus() != MachineStatus.WAITING) {
            LOG.debug("Ignoring load while {}", state.getStatus());
            return state.getStatus();
        }

        DecodedProgram program = decoder.decodeProgram(sourceLines);
        if (!program.isSuccessful()) {
            state.instructionFailed("Decode failure at " + program.failure());
            LOG.info("Program failed to decode: {}", program.failure());
            return state.getStatus();
        }

        instructionStore.install(program.instructions());
        state.getDataMemory().replaceWith(initialMemory);
        state.setStatus(instructionStore.isEmpty() ? MachineStatus.WAITING : MachineStatus.READY);
        LOG.info("Loaded {} instructions with {} memory cells", instructionStore.size(), initialMemory.size());
        return state.getStatus();
    }

    /**
     * Runs the loaded program until it halts or fails.
     *
     * @return HALTED or ERRORED, or the unchanged status if the machine was not READY.
     */
    public MachineStatus run() {
        if (state.getStatus() != MachineStatus.READY) {
            LOG.debug("Ignoring run while {}", state.getStatus());
            return state.getStatus();
        }

        state.setStatus(MachineStatus.RUNNING);
        instructionStore.rewind();
        stepCount = 0L;

        while (state.isRunning()) {
            if (options.isBounded() && stepCount >= options.maxSteps()) {
                state.instructionFailed("Step budget of " + options.maxSteps() + " instructions exhausted");
                break;
            }
            long distance = evaluate(instructionStore.current());
            stepCount++;
            if (state.isRunning()) {
                advance(distance);
            }
        }

        LOG.info("Run finished with status {} after {} instructions", state.getStatus(), stepCount);
        return state.getStatus();
    }

    /**
     * Clears the accumulator, the data memory and the program, and returns to WAITING.
     *
     * @return always {@link MachineStatus#WAITING}.
     */
    public MachineStatus reset() {
        state.reset();
        instructionStore.clear();
        stepCount = 0L;
        return state.getStatus();
    }

    private long evaluate(Instruction instruction) {
        Optional<InstructionHandler> handler = instructionSet.handlerFor(instruction.operation());
        if (handler.isEmpty()) {
            state.instructionFailed("Unknown operation: " + instruction.operation());
            return Config.NEXT_INSTRUCTION;
        }
        return handler.get().execute(context, instruction);
    }

    private void advance(long distance) {
        switch (instructionStore.advance(distance)) {
            case INVALID_DISTANCE -> state.instructionFailed("Cannot advance by a distance of zero");
            case PASSED_END -> state.halt();
            case MOVED -> {
                // still running
            }
        }
    }

    public MachineStatus getStatus() {
        return state.getStatus();
    }

    public long getAccumulator() {
        return state.getAccumulator();
    }

    /**
     * Returns a copy of the data memory. Later changes to the machine are not reflected in it.
     *
     * @return the data memory contents in order.
     */
    public List<Long> getDataMemory() {
        return state.getDataMemory().snapshot();
    }

    /**
     * @return the loaded program in order.
     */
    public List<Instruction> getInstructions() {
        return instructionStore.listing();
    }

    /**
     * @return why the machine is ERRORED, if it is.
     */
    public Optional<String> getFailureReason() {
        return state.getFailureReason();
    }

    /**
     * @return the number of instructions evaluated by the last run.
     */
    public long getStepCount() {
        return stepCount;
    }
}
