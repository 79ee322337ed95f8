package io.github.yok.polar.core.report;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * 反復ごとの経過を表形式でログへ出力する報告先です。
 *
 * <p>
 * 反復番号 1 の報告の前に見出し行を出力します。
 * </p>
 *
 * <pre>
 * Iter.    Rel. err.        Obj.
 *     1    1.000000e+00     5.430000e+06
 * </pre>
 */
@Slf4j
public final class LoggingIterationReporter implements IterationReporter {

    @Override
    public void report(int iteration, double relativeError, double objective) {
        if (iteration == 1) {
            log.info(String.format(Locale.ROOT, "%-5s    %-13s    %-13s", "Iter.", "Rel. err.",
                    "Obj."));
        }
        log.info(format(iteration, relativeError, objective));
    }

    /**
     * 1 反復分の経過を 1 行に整形します。
     *
     * @param iteration 反復番号です
     * @param relativeError 相対変化量です
     * @param objective 目的関数値です
     * @return 整形した行です
     */
    static String format(int iteration, double relativeError, double objective) {
        return String.format(Locale.ROOT, "%5d    %13.6e    %13.6e", iteration, relativeError,
                objective);
    }
}
