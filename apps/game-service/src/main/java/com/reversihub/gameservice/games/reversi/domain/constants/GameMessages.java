package com.reversihub.gameservice.games.reversi.domain.constants;

/**
 * 黑白棋相关的消息常量
 * 统一管理控制台提示与异常码，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 控制台提示 ==========

    /** 当前方无子可下 */
    public static final String CANNOT_MOVE = "user cannot move, skipping...";

    /** 输入提示（需要格式化，传入执子标记） */
    public static final String ENTER_MOVE = "player '%s': please enter your move";

    /** 输入光标 */
    public static final String INPUT_CURSOR = ">>> ";

    /** 非法落子 */
    public static final String INVALID_MOVE = "this is an invalid move. Please try again.";

    /** 游戏结束 */
    public static final String GAME_OVER = " ### GAME OVER ### ";

    /** 终局比分标题 */
    public static final String FINAL_SCORES = "final scores";

    /** 终局比分单行（标记: 子数） */
    public static final String SCORE_LINE = "%s: %d";

    /** 棋盘下方的实时子数（标记=子数） */
    public static final String BOARD_SCORE = "%s=%d";

    /** 棋盘下方的执子提示 */
    public static final String TO_MOVE = "%s to move";

    public static String formatEnterMove(char side) {
        return String.format(ENTER_MOVE, side);
    }

    public static String formatScoreLine(char side, int count) {
        return String.format(SCORE_LINE, side, count);
    }

    public static String formatBoardScore(char side, int count) {
        return String.format(BOARD_SCORE, side, count);
    }

    public static String formatToMove(char side) {
        return String.format(TO_MOVE, side);
    }

    // ========== 异常码 ==========

    /** 落点不在合法着法表内 */
    public static final String ERR_INVALID_MOVE = "INVALID_MOVE";

    /** 对局已结束 */
    public static final String ERR_GAME_FINISHED = "GAME_FINISHED";

    /** 仍有合法着法时不允许跳过 */
    public static final String ERR_PASS_NOT_ALLOWED = "PASS_NOT_ALLOWED";

    /** 棋盘与持子集合不一致 */
    public static final String ERR_INVARIANT_VIOLATION = "INVARIANT_VIOLATION";

    /** 配置不合法 */
    public static final String ERR_BAD_CONFIG = "BAD_CONFIG";
}
