package org.repair.cfg;

/**
 * break/continue 可跳转的外层结构（循环或 switch），以不可变链表的形式随递归向下传递。
 */
final class JumpFrame {

    final Stmt stmt;
    final boolean loop;
    final JumpFrame outer;

    private JumpFrame(Stmt stmt, boolean loop, JumpFrame outer) {
        this.stmt = stmt;
        this.loop = loop;
        this.outer = outer;
    }

    static JumpFrame push(JumpFrame outer, Stmt stmt) {
        return new JumpFrame(stmt, stmt.kind.isLoop(), outer);
    }

    /**
     * break 的目标：无标签时取最近的循环或 switch，有标签时取同名结构。
     */
    static Stmt breakTarget(JumpFrame frames, String label) {
        for (JumpFrame f = frames; f != null; f = f.outer) {
            if (label == null || label.equals(f.stmt.label)) {
                return f.stmt;
            }
        }
        return null;
    }

    /**
     * continue 的目标：跳过 switch，只取循环。
     */
    static Stmt continueTarget(JumpFrame frames, String label) {
        for (JumpFrame f = frames; f != null; f = f.outer) {
            if (f.loop && (label == null || label.equals(f.stmt.label))) {
                return f.stmt;
            }
        }
        return null;
    }
}
