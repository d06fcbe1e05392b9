package com.ac.iisc.plandiff;

/** Execution tier that runs an operator. */
public enum TaskType
{
    /** Coordinating SQL layer ("root"). */
    ROOT,
    /** Row store coprocessor, e.g. {@code cop} or {@code cop[tikv]}. */
    STORAGE_ENGINE,
    /** Columnar analytical store, e.g. {@code cop[tiflash]} or {@code mpp[tiflash]}. */
    COLUMNAR_ENGINE
}
