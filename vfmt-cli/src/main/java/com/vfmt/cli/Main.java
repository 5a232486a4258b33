package com.vfmt.cli;

import picocli.CommandLine;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * vfmt CLI 入口点（picocli）
 */
public final class Main {

    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        // Windows 控制台可能仍用 GBK，按操作系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new FmtCommand());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            Logger.getLogger(Main.class.getName()).log(Level.FINE, "控制台编码不可用: " + charsetName, e);
            System.exit(new CommandLine(new FmtCommand()).execute(args));
        }
    }

    /**
     * 日志输出到 stderr，不与标准输出上的格式化结果混在一起
     */
    static void configureLogging() {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.INFO);
        rootLogger.addHandler(stderrHandler);
    }

    /**
     * 控制台实际使用的字符编码名；native.encoding 反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null) {
            try {
                if (Charset.isSupported(nativeEnc)) {
                    return nativeEnc;
                }
            } catch (IllegalCharsetNameException e) {
                Logger.getLogger(Main.class.getName()).fine("非法的 native.encoding: " + nativeEnc);
            }
        }
        return Charset.defaultCharset().name();
    }
}
