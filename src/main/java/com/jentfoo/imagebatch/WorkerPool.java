package com.jentfoo.imagebatch;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.concurrent.SubmitterScheduler;
import org.threadly.util.ExceptionUtils;

/**
 * Fixed set of workers pulling {@link Job}s from a bounded queue and publishing 
 * {@link ConversionResult}s to a bounded results queue.
 * <p>
 * {@link #stop()} closes the job queue, lets the workers drain what was already queued, and 
 * marks the results closed only once the last worker has exited.  {@link #cancel()} makes 
 * workers give up instead: no new conversions are started, and a worker blocked on the rate 
 * limiter or on a full results queue abandons that result and exits.
 * <p>
 * Each worker occupies a scheduler thread until it exits, so the scheduler must have at least 
 * {@code workerCount} threads available beside whatever thread dispatches jobs.
 */
public class WorkerPool {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
  private static final int QUEUE_SIZE_PER_WORKER = 2;
  private static final long POLL_INTERVAL_IN_MILLIS = 100;

  private final SubmitterScheduler scheduler;
  private final ConverterInterface converter;
  private final RateLimiter rateLimiter;
  private final int workerCount;
  private final CancellationSignal cancellation;
  private final BlockingQueue<Job> jobs;
  private final BlockingQueue<ConversionResult> results;
  private final Object submitLock;
  private final AtomicBoolean started;
  private final CountDownLatch workersDone;
  private volatile boolean jobsClosed;
  private volatile boolean resultsClosed;

  /**
   * @param rateLimit conversions allowed to start per second across all workers, zero or less 
   *                    for no limit
   */
  public WorkerPool(SubmitterScheduler scheduler, ConverterInterface converter, 
                    int workerCount, double rateLimit) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("Must have at least one worker: " + workerCount);
    }

    this.scheduler = scheduler;
    this.converter = converter;
    this.workerCount = workerCount;
    if (rateLimit > 0) {
      rateLimiter = new RateLimiter(rateLimit);
    } else {
      rateLimiter = null;
    }
    cancellation = new CancellationSignal();
    jobs = new ArrayBlockingQueue<Job>(workerCount * QUEUE_SIZE_PER_WORKER);
    results = new ArrayBlockingQueue<ConversionResult>(workerCount * QUEUE_SIZE_PER_WORKER);
    submitLock = new Object();
    started = new AtomicBoolean(false);
    workersDone = new CountDownLatch(workerCount);
    jobsClosed = false;
    resultsClosed = false;
  }

  public void start() {
    if (! started.compareAndSet(false, true)) {
      throw new IllegalStateException("Already started");
    }

    for (int i = 0; i < workerCount; i++) {
      scheduler.execute(new Worker());
    }
    log.debug("Started {} workers{}", workerCount, 
              rateLimiter == null ? "" : " with rate limiting");
  }

  /**
   * Queues the job, blocking while the queue is full.
   * 
   * @return {@code false} if the pool stopped accepting jobs before the job could be queued
   */
  public boolean submit(Job job) {
    synchronized (submitLock) {
      while (true) {
        if (jobsClosed || cancellation.isCancelled()) {
          return false;
        }
        try {
          if (jobs.offer(job, POLL_INTERVAL_IN_MILLIS, TimeUnit.MILLISECONDS)) {
            return true;
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
  }

  /**
   * Stops accepting jobs, waits for every worker to exit, then closes the results.
   */
  public void stop() {
    synchronized (submitLock) {
      jobsClosed = true;
    }

    if (started.get()) {
      boolean interrupted = false;
      while (true) {
        try {
          workersDone.await();
          break;
        } catch (InterruptedException e) {
          // workers exit promptly once cancelled
          interrupted = true;
          cancellation.cancel();
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    resultsClosed = true;
  }

  public void cancel() {
    cancellation.cancel();
  }

  /**
   * Cancels outstanding work then stops the pool.
   */
  public void shutdown() {
    cancel();
    stop();
  }

  public boolean isCancelled() {
    return cancellation.isCancelled();
  }

  public boolean isAcceptingJobs() {
    return ! jobsClosed && ! cancellation.isCancelled();
  }

  /**
   * @return {@code true} once the pool was stopped and every published result was taken
   */
  public boolean isFinished() {
    return resultsClosed && results.isEmpty();
  }

  public boolean isResultsClosed() {
    return resultsClosed;
  }

  /**
   * Waits up to the timeout for the next result.
   * 
   * @return the result or {@code null} if none arrived in time
   */
  public ConversionResult pollResult(long timeout, TimeUnit unit) throws InterruptedException {
    return results.poll(timeout, unit);
  }

  private class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (! cancellation.isCancelled()) {
          Job job;
          try {
            job = jobs.poll(POLL_INTERVAL_IN_MILLIS, TimeUnit.MILLISECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
          if (job == null) {
            if (jobsClosed && jobs.isEmpty()) {
              return;
            } else {
              continue;
            }
          }

          if (rateLimiter != null && ! rateLimiter.acquire(cancellation)) {
            return;
          } else if (cancellation.isCancelled()) {
            return;
          }

          ConversionResult result;
          try {
            result = converter.convert(job);
          } catch (RuntimeException e) {
            ExceptionUtils.handleException(e);
            result = new ConversionResult(job.getSourceFile(), null, 0, 0, 0, e);
          }

          if (! publish(result)) {
            return;
          }
        }
      } finally {
        workersDone.countDown();
      }
    }

    private boolean publish(ConversionResult result) {
      while (true) {
        try {
          if (results.offer(result, POLL_INTERVAL_IN_MILLIS, TimeUnit.MILLISECONDS)) {
            return true;
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
        if (cancellation.isCancelled()) {
          log.debug("Dropping result for cancelled run: {}", result.getOriginalFile());
          return false;
        }
      }
    }
  }
}
