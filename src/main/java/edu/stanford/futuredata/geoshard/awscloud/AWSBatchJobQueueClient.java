package edu.stanford.futuredata.geoshard.awscloud;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.http.timers.client.ClientExecutionTimeoutException;
import com.amazonaws.services.batch.AWSBatch;
import com.amazonaws.services.batch.AWSBatchClientBuilder;
import com.amazonaws.services.batch.model.*;
import edu.stanford.futuredata.geoshard.errors.BackendTimeoutException;
import edu.stanford.futuredata.geoshard.errors.BackendUnavailableException;
import edu.stanford.futuredata.geoshard.errors.JobSubmissionException;
import edu.stanford.futuredata.geoshard.pipeline.JobQueueClient;
import edu.stanford.futuredata.geoshard.pipeline.JobSpec;
import edu.stanford.futuredata.geoshard.pipeline.JobState;
import edu.stanford.futuredata.geoshard.pipeline.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs preprocessing jobs on AWS Batch.  Every job uses the same job definition, a container that reads its
 * operation and file locations from the environment.
 */
public class AWSBatchJobQueueClient implements JobQueueClient {
    private static final Logger logger = LoggerFactory.getLogger(AWSBatchJobQueueClient.class);

    public static final String DEFAULT_JOB_QUEUE = "osrm-batch-queue";
    public static final String DEFAULT_JOB_DEFINITION = "osrm-batch-job";
    public static final String DEFAULT_REGION = "us-east-1";
    public static final int DEFAULT_TIMEOUT = 30000;

    private static final String BACKEND = "aws-batch";
    private static final Set<String> THROTTLING_ERROR_CODES =
            Set.of("TooManyRequestsException", "ThrottlingException", "Throttling");

    private final AWSBatch batch;
    private final String jobQueue;
    private final String jobDefinition;

    public AWSBatchJobQueueClient(String region, String jobQueue, String jobDefinition) {
        this(AWSBatchClientBuilder.standard()
                .withRegion(region)
                .withClientConfiguration(new ClientConfiguration()
                        .withRequestTimeout(DEFAULT_TIMEOUT)
                        .withClientExecutionTimeout(DEFAULT_TIMEOUT))
                .build(), jobQueue, jobDefinition);
    }

    public AWSBatchJobQueueClient(AWSBatch batch, String jobQueue, String jobDefinition) {
        this.batch = batch;
        this.jobQueue = jobQueue;
        this.jobDefinition = jobDefinition;
    }

    @Override
    public String submit(JobSpec spec) {
        List<KeyValuePair> environment = spec.environment().entrySet().stream()
                .map(e -> new KeyValuePair().withName(e.getKey()).withValue(e.getValue()))
                .collect(Collectors.toList());
        SubmitJobRequest request = new SubmitJobRequest()
                .withJobName(spec.jobName)
                .withJobQueue(jobQueue)
                .withJobDefinition(jobDefinition)
                .withContainerOverrides(new ContainerOverrides().withEnvironment(environment));
        try {
            SubmitJobResult result = batch.submitJob(request);
            logger.debug("Submitted {} to {}: {}", spec.jobName, jobQueue, result.getJobId());
            return result.getJobId();
        } catch (ClientException e) {
            if (isThrottled(e)) {
                throw new BackendUnavailableException(BACKEND, e);
            }
            throw new JobSubmissionException(String.format("%s rejected %s: %s", jobQueue, spec.jobName,
                    e.getErrorMessage()), e);
        } catch (ServerException e) {
            throw new BackendUnavailableException(BACKEND, e);
        } catch (ClientExecutionTimeoutException e) {
            throw new BackendTimeoutException(BACKEND, e);
        } catch (SdkClientException e) {
            throw new BackendUnavailableException(BACKEND, e);
        }
    }

    @Override
    public JobStatus poll(String jobID) {
        DescribeJobsResult result;
        try {
            result = batch.describeJobs(new DescribeJobsRequest().withJobs(jobID));
        } catch (ClientException e) {
            if (isThrottled(e)) {
                throw new BackendUnavailableException(BACKEND, e);
            }
            return JobStatus.failed("Cannot describe " + jobID + ": " + e.getErrorMessage());
        } catch (ClientExecutionTimeoutException e) {
            throw new BackendTimeoutException(BACKEND, e);
        } catch (SdkClientException e) {
            throw new BackendUnavailableException(BACKEND, e);
        }
        if (result.getJobs().isEmpty()) {
            return JobStatus.failed("Job " + jobID + " not found in " + jobQueue);
        }
        JobDetail detail = result.getJobs().get(0);
        return new JobStatus(toJobState(detail.getStatus()), detail.getStatusReason());
    }

    @Override
    public boolean cancel(String jobID) {
        try {
            batch.terminateJob(new TerminateJobRequest().withJobId(jobID).withReason("Pipeline cancelled"));
            return true;
        } catch (SdkClientException e) {
            logger.warn("Terminating {} failed: {}", jobID, e.getMessage());
            return false;
        }
    }

    @Override
    public void shutdown() {
        batch.shutdown();
    }

    // Batch answers a request rate above its limit with a client error.
    static boolean isThrottled(AmazonServiceException e) {
        String errorCode = e.getErrorCode();
        return e.getStatusCode() == 429 || (errorCode != null && THROTTLING_ERROR_CODES.contains(errorCode));
    }

    // Batch reports SUBMITTED, PENDING, RUNNABLE, STARTING, RUNNING, SUCCEEDED or FAILED.
    static JobState toJobState(String batchStatus) {
        if (batchStatus == null) {
            throw new IllegalArgumentException("Job without status");
        }
        switch (batchStatus) {
            case "SUBMITTED":
            case "PENDING":
            case "RUNNABLE":
            case "STARTING":
                return JobState.SUBMITTED;
            case "RUNNING":
                return JobState.RUNNING;
            case "SUCCEEDED":
                return JobState.SUCCEEDED;
            case "FAILED":
                return JobState.FAILED;
            default:
                throw new IllegalArgumentException("Unknown AWS Batch job status " + batchStatus);
        }
    }
}
