/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.refactor.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты поиска связанных файлов по соглашениям об именах.
 */
class RelatedFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testNamingConventions() {
        assertTrue(RelatedFiles.isRelated("UserTest.java", "User"));
        assertTrue(RelatedFiles.isRelated("UserImpl.java", "User"));
        assertTrue(RelatedFiles.isRelated("UserInterface.ts", "User"));
        assertTrue(RelatedFiles.isRelated("UserBase.py", "User"));
        assertTrue(RelatedFiles.isRelated("UserAbstract.java", "User"));
        assertTrue(RelatedFiles.isRelated("TestUser.java", "User"));
        assertTrue(RelatedFiles.isRelated("IUser.cs", "User"));

        assertFalse(RelatedFiles.isRelated("User.java", "User"));
        assertFalse(RelatedFiles.isRelated("UserService.java", "User"));
        assertFalse(RelatedFiles.isRelated("UserTests.java", "User"));
        assertFalse(RelatedFiles.isRelated("MyUserTest.java", "User"));
    }

    @Test
    void testFindWalksSubdirectories() throws IOException {
        Path main = tempDir.resolve("User.java");
        for (String name : List.of("User.java", "UserService.java", "impl/UserImpl.java", "test/UserTest.java",
                "IUser.java")) {
            Path file = tempDir.resolve(name);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "x");
        }

        List<Path> related = RelatedFiles.find(main, "User");

        assertEquals(List.of(tempDir.resolve("IUser.java"), tempDir.resolve("impl/UserImpl.java"),
                tempDir.resolve("test/UserTest.java")), related, "Сам файл и посторонние файлы не включаются");
    }
}
