package com.example.tubefetch.config;

import net.bramp.ffmpeg.ProcessFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts ffmpeg/ffprobe processes for the wrapper library and remembers the live ones by their
 * last argument (the output file for ffmpeg), so a running conversion can be killed on request.
 * <p>
 * A kill requested before the matching process exists is kept pending and applied the moment
 * that process starts.
 */
public class TrackingProcessFunction implements ProcessFunction {

    private static final Logger log = LoggerFactory.getLogger(TrackingProcessFunction.class);

    private final Map<String, Process> running = new ConcurrentHashMap<>();
    private final Set<String> pendingKills = new HashSet<>();

    @Override
    public Process run(List<String> args) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(args).redirectErrorStream(true);
        Process process = builder.start();

        String key = args.isEmpty() ? "" : args.get(args.size() - 1);
        boolean killRequested;
        synchronized (pendingKills) {
            killRequested = pendingKills.remove(key);
            if (!killRequested) {
                running.put(key, process);
            }
        }
        if (killRequested) {
            log.info("Killing ffmpeg writing {} on start, it was aborted while being prepared", key);
            process.destroyForcibly();
            return process;
        }
        process.onExit().thenRun(() -> running.remove(key, process));
        log.debug("Started {} (pid {})", args.isEmpty() ? "?" : args.get(0), process.pid());
        return process;
    }

    /**
     * Forcibly stops the process whose last argument is {@code outputPath}. When no such process is
     * running yet, the next one started for {@code outputPath} is killed instead.
     *
     * @return true if a live process was found and killed.
     */
    public boolean terminate(String outputPath) {
        Process process;
        synchronized (pendingKills) {
            process = running.remove(outputPath);
            if (process == null || !process.isAlive()) {
                pendingKills.add(outputPath);
                return false;
            }
        }
        log.info("Terminating ffmpeg writing {}", outputPath);
        process.destroyForcibly();
        return true;
    }

    /**
     * Drops a kill still pending for {@code outputPath}, once its conversion is over.
     */
    public void release(String outputPath) {
        synchronized (pendingKills) {
            pendingKills.remove(outputPath);
        }
    }

    int runningCount() {
        return running.size();
    }

    int pendingKillCount() {
        synchronized (pendingKills) {
            return pendingKills.size();
        }
    }
}
