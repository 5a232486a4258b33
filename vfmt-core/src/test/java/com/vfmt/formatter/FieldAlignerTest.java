package com.vfmt.formatter;

import com.vfmt.ast.Comment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

class FieldAlignerTest {

    @Test
    @DisplayName("补齐到组内最长名称")
    void testPadding() {
        FieldAligner aligner = FieldAligner.of(Arrays.asList(1, 2, 3));
        assertThat(aligner.getWidth()).isEqualTo(3);
        assertThat(aligner.padding(1)).isEqualTo("  ");
        assertThat(aligner.padding(3)).isEmpty();
    }

    @Test
    @DisplayName("空组宽度为 0")
    void testEmpty() {
        FieldAligner aligner = FieldAligner.of(Collections.<Integer>emptyList());
        assertThat(aligner.getWidth()).isZero();
        assertThat(aligner.padding(0)).isEmpty();
    }

    @Test
    @DisplayName("行内注释计入显示宽度")
    void testDisplayLengthWithInlineComment() {
        Comment c = new Comment(Trees.at(1), " id ");
        assertThat(FieldAligner.displayLength("name", Collections.singletonList(c)))
                .isEqualTo("name /* id */".length());
        assertThat(FieldAligner.displayLength("x", Collections.<Comment>emptyList())).isEqualTo(1);
    }
}
