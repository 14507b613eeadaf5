package io.playengine.storage;

public final class JobFields {
    public static final String STATUS = "status";
    public static final String CELERY_TASK_ID = "celery_task_id";
    public static final String OUTPUT_REPLACEMENTS = "output_replacements";
    public static final String RESULT_TRACEBACK = "result_traceback";
    public static final String JOB_ARGS = "job_args";
    public static final String JOB_CWD = "job_cwd";
    public static final String JOB_ENV = "job_env";
    public static final String RESULT_STDOUT_FILE = "result_stdout_file";
    public static final String JOB_EXPLANATION = "job_explanation";

    private JobFields() {
    }
}
