package com.ttm.backend.pr.program;

import java.util.List;

/**
 * 外部服務：使用者課表動作（A→E 各訓練合併，依訓練順序）。
 * 名稱應已是 ExerciseNormalizer 的 canonical 形式；這邊不負責。
 */
public interface ProgramExerciseProvider {

    List<String> programExercises(long userId);
}
