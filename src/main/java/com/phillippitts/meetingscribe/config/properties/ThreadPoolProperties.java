package com.phillippitts.meetingscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizes of the pipeline's two executors.
 *
 * <pre>
 * threadpool.stt.core-pool-size=4
 * threadpool.stt.max-pool-size=8
 * threadpool.stt.queue-capacity=50
 * threadpool.stream.core-pool-size=4
 * threadpool.stream.max-pool-size=16
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SttPoolProperties stt = new SttPoolProperties();
    private StreamPoolProperties stream = new StreamPoolProperties();

    public SttPoolProperties getStt() {
        return stt;
    }

    public void setStt(SttPoolProperties stt) {
        this.stt = stt;
    }

    public StreamPoolProperties getStream() {
        return stream;
    }

    public void setStream(StreamPoolProperties stream) {
        this.stream = stream;
    }

    /**
     * Settings shared by both pools.
     */
    public abstract static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        protected PoolProperties(int corePoolSize, int maxPoolSize, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Backend call pool. A full queue rejects the task and the window is dropped.
     */
    public static class SttPoolProperties extends PoolProperties {
        private int queueCapacity = 50;

        public SttPoolProperties() {
            super(4, 8, "stt-pool-");
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Stream reader and dispatcher loop pool. Tasks go straight to a thread; there is no queue.
     * Each merger start takes two threads and each dispatcher start one.
     */
    public static class StreamPoolProperties extends PoolProperties {
        public StreamPoolProperties() {
            super(4, 16, "stream-pool-");
        }
    }
}
