package org.shellgo.compiler.backend.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs tools with {@link ProcessBuilder}, merging standard error into standard output.
 */
public final class ProcessToolRunner implements ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public ToolResult run(List<String> command, Path workingDirectory, Duration timeout) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.redirectErrorStream(true);
        log.debug("Running {} in {}", command, workingDirectory);

        Process process = pb.start();
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        Thread reader = new Thread(() -> {
            try (InputStream stream = process.getInputStream()) {
                stream.transferTo(captured);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, "tool-output-" + command.get(0));
        reader.setDaemon(true);
        reader.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            process.waitFor();
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));
        String output;
        synchronized (captured) {
            output = captured.toString(StandardCharsets.UTF_8);
        }
        if (!finished) {
            log.warn("{} exceeded its time limit of {}", command.get(0), timeout);
            return new ToolResult(-1, output, true);
        }
        return new ToolResult(process.exitValue(), output, false);
    }
}
