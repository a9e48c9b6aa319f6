/**
 * SourceFormattingService.java
 *
 * 通过外部格式化器子进程对源码进行格式化。
 *
 * 设计思路:
 * 1.  **隔离执行**: 使用 `ProcessBuilder` 启动 Settings 中配置的格式化命令，格式化器的任何崩溃都不会影响主进程。
 * 2.  **无文件I/O**: 源码通过子进程的标准输入传入，格式化结果从标准输出读取。
 * 3.  **尽力而为**: 未配置命令或关闭了 formatOnMutation 时原样返回；非零退出码或超时抛出
 *     SourceFormattingException，由 StructuralMutator 决定保留未格式化的文本。
 */
package club.ppmc.visualsync.service;

import club.ppmc.visualsync.engine.mutation.SourceFormatter;
import club.ppmc.visualsync.exception.SourceFormattingException;
import club.ppmc.visualsync.model.Settings;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SourceFormattingService implements SourceFormatter {

    /** 读写子进程管道的守护线程，每个管道一个。 */
    private static final ExecutorService PIPE_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "formatter-pipe");
        thread.setDaemon(true);
        return thread;
    });

    private final SettingsService settingsService;

    public SourceFormattingService(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    public boolean isEnabled() {
        Settings settings = settingsService.getSettings();
        return settings.isFormatOnMutation()
                && settings.getFormatterCommand() != null
                && !settings.getFormatterCommand().isEmpty();
    }

    /**
     * 格式化给定的源码字符串。
     *
     * @param source 未经格式化的源码。
     * @return 格式化后的源码；未配置格式化器时原样返回。
     * @throws SourceFormattingException 如果子进程无法启动、超时或以非零退出码结束。
     */
    @Override
    public String format(String source) throws SourceFormattingException {
        if (!isEnabled()) {
            return source;
        }
        Settings settings = settingsService.getSettings();
        List<String> command = settings.getFormatterCommand();
        log.debug("执行格式化命令: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new SourceFormattingException("无法启动格式化器: " + command.get(0), e);
        }

        long timeoutMillis = TimeUnit.SECONDS.toMillis(settings.getFormatterTimeoutSeconds());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try {
            // 读写都在后台线程进行，子进程不读标准输入时写入阻塞也不会越过超时
            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());
            CompletableFuture<Void> stdin = writeAsync(process.getOutputStream(), source);

            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw timedOut(settings);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String errorOutput = stderr.get(remaining(deadline), TimeUnit.NANOSECONDS);
                log.warn("格式化子进程执行失败，退出码: {}，错误输出: {}", exitCode, errorOutput);
                throw new SourceFormattingException(
                        "格式化失败: " + (errorOutput.isBlank() ? "未知错误" : errorOutput.strip()));
            }
            stdin.get(remaining(deadline), TimeUnit.NANOSECONDS);
            return stdout.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw timedOut(settings);
        } catch (ExecutionException e) {
            throw new SourceFormattingException("与格式化器通信失败: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFormattingException("格式化被中断", e);
        } finally {
            // 强制结束子进程，同时让仍阻塞在管道上的读写线程退出
            process.destroyForcibly();
        }
    }

    private static SourceFormattingException timedOut(Settings settings) {
        return new SourceFormattingException(
                "格式化器在 " + settings.getFormatterTimeoutSeconds() + " 秒内未完成");
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private static CompletableFuture<Void> writeAsync(OutputStream stream, String source) {
        return CompletableFuture.runAsync(() -> {
            try (stream) {
                stream.write(source.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, PIPE_EXECUTOR);
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return IOUtils.toString(stream, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, PIPE_EXECUTOR);
    }
}
