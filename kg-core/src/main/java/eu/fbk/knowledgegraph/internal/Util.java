package eu.fbk.knowledgegraph.internal;

import java.io.File;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.io.Resources;
import com.google.common.util.concurrent.ForwardingListeningExecutorService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    @Nullable
    public static URL getURL(final String location) {
        try {
            final URL url = Resources.getResource(location.startsWith("/") ? location
                    .substring(1) : location);
            if (url != null) {
                return url;
            }
        } catch (final IllegalArgumentException ex) {
            // not a classpath resource - ignore
        }
        try {
            final File file = new File(location);
            if (file.exists() && file.isFile()) {
                return file.toURI().toURL();
            }
        } catch (final IOException ex) {
            // not a file - ignore
        }
        return null;
    }

    public static ListeningExecutorService newExecutor(final int numThreads,
            final String nameFormat, final boolean daemon) {
        Preconditions.checkArgument(numThreads > 0, "Invalid thread count %s", numThreads);
        final ThreadFactory factory = new ThreadFactoryBuilder().setDaemon(daemon)
                .setNameFormat(nameFormat)
                .setUncaughtExceptionHandler(new UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread thread, final Throwable ex) {
                        LOGGER.error("Uncaught exception in thread " + thread.getName(), ex);
                    }

                }).build();
        return new MDCExecutorService(MoreExecutors.listeningDecorator(Executors
                .newFixedThreadPool(numThreads, factory)));
    }

    private static final class MDCExecutorService extends ForwardingListeningExecutorService {

        private final ListeningExecutorService delegate;

        MDCExecutorService(final ListeningExecutorService delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected ListeningExecutorService delegate() {
            return this.delegate;
        }

        private Runnable wrap(final Runnable runnable, @Nullable final Map<String, String> mdc) {
            return new Runnable() {

                @Override
                public void run() {
                    final Map<String, String> oldMdc = Logging.getMDC();
                    try {
                        Logging.setMDC(mdc);
                        runnable.run();
                    } finally {
                        Logging.setMDC(oldMdc);
                    }
                }

            };
        }

        private <T> Callable<T> wrap(final Callable<T> callable,
                @Nullable final Map<String, String> mdc) {
            return new Callable<T>() {

                @Override
                public T call() throws Exception {
                    final Map<String, String> oldMdc = Logging.getMDC();
                    try {
                        Logging.setMDC(mdc);
                        return callable.call();
                    } catch (final Throwable ex) {
                        Throwables.propagateIfPossible(ex, Exception.class);
                        throw new RuntimeException(ex);
                    } finally {
                        Logging.setMDC(oldMdc);
                    }
                }

            };
        }

        @Override
        public void execute(final Runnable command) {
            delegate().execute(wrap(command, Logging.getMDC()));
        }

        @Override
        public <T> ListenableFuture<T> submit(final Callable<T> task) {
            return delegate().submit(wrap(task, Logging.getMDC()));
        }

        @Override
        public ListenableFuture<?> submit(final Runnable task) {
            return delegate().submit(wrap(task, Logging.getMDC()));
        }

        @Override
        public <T> ListenableFuture<T> submit(final Runnable task, final T result) {
            return delegate().submit(wrap(task, Logging.getMDC()), result);
        }

    }

}
