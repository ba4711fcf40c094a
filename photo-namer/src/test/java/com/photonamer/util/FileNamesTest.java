package com.photonamer.util;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileNamesTest {

    @Test
    void splitsStemAndLowercasedExtension() {
        assertThat(FileNames.stem("IMG_0001.JPG")).isEqualTo("IMG_0001");
        assertThat(FileNames.extension("IMG_0001.JPG")).isEqualTo(".jpg");
        assertThat(FileNames.extension(Path.of("photos", "a.b.Jpeg"))).isEqualTo(".jpeg");
    }

    @Test
    void treatsLeadingDotAsPartOfStem() {
        assertThat(FileNames.stem(".hidden")).isEqualTo(".hidden");
        assertThat(FileNames.extension(".hidden")).isEmpty();
        assertThat(FileNames.extension("README")).isEmpty();
    }
}
