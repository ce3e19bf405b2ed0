package com.tony.cricketLeague.model.dto;

import com.tony.cricketLeague.model.MergeWarning;
import com.tony.cricketLeague.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MergeResult {
    private Player mergedPlayer;
    private List<String> mergedFields;
    private boolean careerStatsCombined;
    private boolean sourceDeleted;
    private RewriteReport referenceRewrite;
    private List<MergeWarning> warnings;
    // Tâche de réparation créée si la réécriture est incomplète
    private Long repairTaskId;
}
