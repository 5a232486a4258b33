package com.vfmt.formatter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 代码格式化配置
 */
public class FormatConfig {

    /** 默认换行宽度档位，下标即换行惩罚值 */
    public static final int[] DEFAULT_WIDTH_TIERS = {35, 60, 85, 93, 100};

    /** 缺少 import 时会被自动导入的常用模块 */
    public static final List<String> DEFAULT_AUTO_IMPORT_MODULES =
            Collections.unmodifiableList(Arrays.asList("time", "os", "strings", "math", "json", "base64"));

    private int indentSize = 4;
    private boolean useSpaces = false;
    private int[] widthTiers = DEFAULT_WIDTH_TIERS.clone();
    private int longSegmentThreshold = 55;
    private boolean preserveBlankLines = true;
    private boolean removeUnusedImports = false;
    private List<String> autoImportModules = new ArrayList<String>(DEFAULT_AUTO_IMPORT_MODULES);
    private boolean debug = false;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public int[] getWidthTiers() {
        return widthTiers.clone();
    }

    public void setWidthTiers(int[] widthTiers) {
        this.widthTiers = widthTiers != null ? widthTiers.clone() : new int[0];
    }

    /**
     * 惩罚值对应的宽度上限，超出范围时取最近的档位
     */
    public int getTier(int penalty) {
        if (penalty < 0) {
            return widthTiers[0];
        }
        return widthTiers[Math.min(penalty, widthTiers.length - 1)];
    }

    /** 最高档位下标，即"不换行" */
    public int getTopPenalty() {
        return widthTiers.length - 1;
    }

    public int getMaxLineWidth() {
        return widthTiers[widthTiers.length - 1];
    }

    /**
     * 修改最高档位宽度
     */
    public void setMaxLineWidth(int maxLineWidth) {
        widthTiers[widthTiers.length - 1] = maxLineWidth;
    }

    public int getLongSegmentThreshold() {
        return longSegmentThreshold;
    }

    public void setLongSegmentThreshold(int longSegmentThreshold) {
        this.longSegmentThreshold = longSegmentThreshold;
    }

    public boolean isPreserveBlankLines() {
        return preserveBlankLines;
    }

    public void setPreserveBlankLines(boolean preserveBlankLines) {
        this.preserveBlankLines = preserveBlankLines;
    }

    public boolean isRemoveUnusedImports() {
        return removeUnusedImports;
    }

    public void setRemoveUnusedImports(boolean removeUnusedImports) {
        this.removeUnusedImports = removeUnusedImports;
    }

    public List<String> getAutoImportModules() {
        return Collections.unmodifiableList(autoImportModules);
    }

    public void setAutoImportModules(List<String> autoImportModules) {
        this.autoImportModules = autoImportModules != null
                ? new ArrayList<String>(autoImportModules)
                : new ArrayList<String>();
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }

    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 缩进为负、档位为空或不严格递增
     */
    public void validate() {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize 不能为负: " + indentSize);
        }
        if (widthTiers.length == 0) {
            throw new IllegalArgumentException("widthTiers 不能为空");
        }
        for (int i = 0; i < widthTiers.length; i++) {
            if (widthTiers[i] <= 0) {
                throw new IllegalArgumentException("宽度档位必须为正: " + Arrays.toString(widthTiers));
            }
            if (i > 0 && widthTiers[i] <= widthTiers[i - 1]) {
                throw new IllegalArgumentException("宽度档位必须严格递增: " + Arrays.toString(widthTiers));
            }
        }
        if (longSegmentThreshold <= 0) {
            throw new IllegalArgumentException("longSegmentThreshold 必须为正: " + longSegmentThreshold);
        }
    }
}
