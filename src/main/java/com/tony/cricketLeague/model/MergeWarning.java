package com.tony.cricketLeague.model;

public enum MergeWarning {
    // Certaines collections pointent encore vers l'ancien joueur, une tâche de réparation est en file
    REFERENCE_REWRITE_INCOMPLETE
}
