package com.whereq.poolstat.model;

/**
 * Record attribute names the aggregator reads
 */
public final class Attributes {

    private Attributes() {
    }

    // Job identity and ownership
    public static final String CLUSTER_ID = "ClusterId";
    public static final String PROC_ID = "ProcId";
    public static final String OWNER = "Owner";
    public static final String ACCOUNTING_GROUP = "AccountingGroup";
    public static final String JOB_STATUS = JobStatus.STATUS_ATTRIBUTE;
    public static final String JOB_UNIVERSE = JobStatus.UNIVERSE_ATTRIBUTE;

    // Job timestamps (epoch seconds)
    public static final String QUEUE_DATE = "QDate";
    public static final String JOB_CURRENT_START_DATE = "JobCurrentStartDate";
    public static final String ENTERED_CURRENT_STATUS = "EnteredCurrentStatus";

    // Job siting
    public static final String DESIRED_USAGE_MODEL = "DESIRED_usage_model";
    public static final String DESIRED_SITES = "DESIRED_Sites";
    public static final String MATCH_SITE = "MATCH_GLIDEIN_Site";
    public static final String MATCH_RESOURCE_NAME = "MATCH_EXP_JOBGLIDEIN_ResourceName";

    // Job requests
    public static final String REQUEST_CPUS = "RequestCpus";
    public static final String REQUEST_MEMORY = "RequestMemory";
    public static final String REQUEST_DISK = "RequestDisk";
    public static final String REQUEST_GPUS = "RequestGpus";

    // Job usage
    public static final String REMOTE_USER_CPU = "RemoteUserCpu";
    public static final String RESIDENT_SET_SIZE = "ResidentSetSize";
    public static final String RESIDENT_SET_SIZE_RAW = "ResidentSetSize_RAW";
    public static final String DISK_USAGE = "DiskUsage";
    public static final String DISK_USAGE_RAW = "DiskUsage_RAW";
    public static final String ASSIGNED_GPUS = "AssignedGPUs";
    public static final String GPUS_PROVISIONED = "GPUsProvisioned";
    public static final String GPUS_USAGE = "GPUsUsage";

    // Slot identity and state
    public static final String NAME = "Name";
    public static final String SLOT_TYPE = "SlotType";
    public static final String STATE = "State";
    public static final String IS_GLIDEIN = "IS_GLIDEIN";
    public static final String SLOT_WEIGHT = "SlotWeight";
    public static final String REMOTE_GROUP = "RemoteGroup";
    public static final String REMOTE_OWNER = "RemoteOwner";
    public static final String KFLOPS = "kflops";

    // Slot capacity
    public static final String CPUS = "Cpus";
    public static final String TOTAL_SLOT_CPUS = "TotalSlotCpus";
    public static final String TOTAL_CPUS = "TotalCpus";
    public static final String MEMORY = "Memory";
    public static final String TOTAL_SLOT_MEMORY = "TotalSlotMemory";
    public static final String TOTAL_MEMORY = "TotalMemory";
    public static final String DISK = "Disk";
    public static final String TOTAL_SLOT_DISK = "TotalSlotDisk";
    public static final String TOTAL_DISK = "TotalDisk";
    public static final String GPUS = "Gpus";
    public static final String TOTAL_SLOT_GPUS = "TotalSlotGpus";
    public static final String TOTAL_GPUS = "TotalGpus";

    // Slot load
    public static final String LOAD_AVG = "LoadAvg";
    public static final String TOTAL_CONDOR_LOAD_AVG = "TotalCondorLoadAvg";
    public static final String TOTAL_LOAD_AVG = "TotalLoadAvg";
    public static final String TOTAL_GPUS_USAGE = "TotalGPUs-usage";
    public static final String TOTAL_GPUS_USED_MEM = "TotalGPUs-used_mem";
    public static final String AVG_GPUS_USAGE = "AvgGPUs-usage";
    public static final String AVG_GPUS_USED_MEM = "AvgGPUs-used_mem";
}
