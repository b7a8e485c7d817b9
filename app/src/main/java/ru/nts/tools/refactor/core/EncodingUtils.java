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
package ru.nts.tools.refactor.core;

import org.mozilla.universalchardet.UniversalDetector;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Утилиты для определения кодировки и безопасного чтения текстовых файлов.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 * Кодировка и BOM прочитанного файла сохраняются, чтобы запись вернула файл в том же виде.
 */
public final class EncodingUtils {

    private static final Charset FALLBACK_CYRILLIC = Charset.forName("windows-1251");
    private static final byte[] NO_BOM = new byte[0];

    private EncodingUtils() {
    }

    /**
     * Результат чтения текстового файла с определенной кодировкой.
     *
     * @param content Содержимое файла в виде строки (без BOM).
     * @param charset Кодировка, использованная для декодирования байтов.
     * @param bom     Снятый при чтении BOM (пустой массив, если его не было).
     */
    public record TextFileContent(String content, Charset charset, byte[] bom) {

        public boolean hasBom() {
            return bom.length > 0;
        }

        /**
         * Кодирует новый текст так же, как был закодирован исходный файл (та же кодировка, тот же BOM).
         */
        public byte[] encode(String newContent) throws CharacterCodingException {
            return EncodingUtils.encode(newContent, charset, bom);
        }
    }

    /**
     * Считывает файл с автоопределением кодировки, используя политику повторов чтения.
     *
     * @throws FileOperationException файл недоступен, заблокирован или является бинарным
     */
    public static TextFileContent readTextFile(Path path, RetryExecutor retry, RetryPolicy policy) {
        byte[] allBytes = FileUtils.safeReadAllBytes(path, retry, policy);
        return decode(path, allBytes);
    }

    /**
     * Декодирует уже прочитанные байты файла.
     */
    public static TextFileContent decode(Path path, byte[] allBytes) {
        Charset charset = detect(allBytes, allBytes.length);
        byte[] bom = bomOf(allBytes, charset);
        byte[] body = bom.length > 0 ? Arrays.copyOfRange(allBytes, bom.length, allBytes.length) : allBytes;

        // Проверка на бинарный файл (наличие NULL-байтов), кроме многобайтовых кодировок UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(body.length, 8192);
            for (int i = 0; i < checkLimit; i++) {
                if (body[i] == 0) {
                    throw new FileOperationException(ErrorCode.FILE_READ_FAILED, path,
                            "Binary file detected (contains NULL bytes): " + path);
                }
            }
        }
        return new TextFileContent(new String(body, charset), charset, bom);
    }

    /**
     * Кодирует текст, отказываясь от непредставимых символов вместо тихой замены на '?'.
     */
    public static byte[] encode(String content, Charset charset, byte[] bom) throws CharacterCodingException {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer = encoder.encode(CharBuffer.wrap(content));
        byte[] prefix = bom != null ? bom : NO_BOM;
        byte[] result = new byte[prefix.length + buffer.remaining()];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        buffer.get(result, prefix.length, buffer.remaining());
        return result;
    }

    static Charset detect(byte[] bytes, int length) {
        if (length == 0) {
            return StandardCharsets.UTF_8;
        }
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            charset = forNameOrUtf8(encoding);
        }
        // ASCII-файл расширяем до UTF-8, иначе новый не-ASCII текст не запишется
        if (charset.equals(StandardCharsets.US_ASCII)) {
            charset = StandardCharsets.UTF_8;
        }

        // Детектор часто не узнает кириллицу в коротких файлах: невалидный UTF-8 считаем windows-1251
        if (encoding == null || charset.equals(StandardCharsets.UTF_8)) {
            if (!isValidUtf8(bytes, length)) {
                charset = FALLBACK_CYRILLIC;
            }
        }
        return charset;
    }

    private static Charset forNameOrUtf8(String encoding) {
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static byte[] bomOf(byte[] b, Charset charset) {
        String name = charset.name().toUpperCase(Locale.ROOT);
        if (!name.startsWith("UTF-")) return NO_BOM; // BOM только для UTF

        int offset = 0;
        if (name.equals("UTF-8")) {
            if (startsWith(b, 0xEF, 0xBB, 0xBF)) offset = 3;
        } else if (name.equals("UTF-16BE")) {
            if (startsWith(b, 0xFE, 0xFF)) offset = 2;
        } else if (name.equals("UTF-16LE")) {
            if (startsWith(b, 0xFF, 0xFE)) offset = 2;
        } else if (name.equals("UTF-16")) {
            if (startsWith(b, 0xFE, 0xFF) || startsWith(b, 0xFF, 0xFE)) offset = 2;
        } else if (name.equals("UTF-32BE")) {
            if (startsWith(b, 0x00, 0x00, 0xFE, 0xFF)) offset = 4;
        } else if (name.equals("UTF-32LE")) {
            if (startsWith(b, 0xFF, 0xFE, 0x00, 0x00)) offset = 4;
        } else if (name.equals("UTF-32")) {
            if (startsWith(b, 0x00, 0x00, 0xFE, 0xFF) || startsWith(b, 0xFF, 0xFE, 0x00, 0x00)) offset = 4;
        }
        return offset > 0 ? Arrays.copyOf(b, offset) : NO_BOM;
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) return false;
        }
        return true;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    private static boolean isValidUtf8(byte[] bytes, int length) {
        int i = 0;
        while (i < length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
