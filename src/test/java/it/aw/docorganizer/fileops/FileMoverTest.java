package it.aw.docorganizer.fileops;

import it.aw.docorganizer.model.ConflictResolution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileMoverTest {

    @TempDir
    Path dir;

    private final FileMover mover = new FileMover();

    @Test
    void movesFileCreatingDirectories() throws IOException {
        Path source = write("scan.pdf", "contenuto");
        Path target = dir.resolve("fatture/2024/fattura.pdf");

        MoveResult result = mover.move(source, target, ConflictResolution.SKIP, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.MOVED);
        assertThat(result.completed()).isTrue();
        assertThat(source).doesNotExist();
        assertThat(result.finalPath()).hasContent("contenuto");
        assertThat(result.finalPath()).isEqualTo(dir.toRealPath().resolve("fatture/2024/fattura.pdf"));
    }

    @Test
    void sameSourceAndTargetIsNoOp() throws IOException {
        Path source = write("a.pdf", "x");
        FileTime mtime = FileTime.from(Instant.parse("2023-05-01T10:00:00Z"));
        Files.setLastModifiedTime(source, mtime);
        Object fileKey = Files.readAttributes(source, BasicFileAttributes.class).fileKey();

        MoveResult result = mover.move(source, dir.resolve("a.pdf"), ConflictResolution.OVERWRITE, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.UNCHANGED);
        assertThat(source).exists();
        assertThat(Files.getLastModifiedTime(source)).isEqualTo(mtime);
        assertThat(Files.readAttributes(source, BasicFileAttributes.class).fileKey()).isEqualTo(fileKey);
    }

    @Test
    void missingSourceIsReportedNotThrown() {
        MoveResult result = mover.move(dir.resolve("fantasma.pdf"), dir.resolve("b.pdf"),
                ConflictResolution.SKIP, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.SOURCE_NOT_FOUND);
        assertThat(result.finalPath()).isNull();
        assertThatThrownBy(result::orThrow).isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void skipLeavesBothFilesUntouched() throws IOException {
        Path source = write("a.pdf", "nuovo");
        Path target = write("b.pdf", "esistente");

        MoveResult result = mover.move(source, target, ConflictResolution.SKIP, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.CONFLICT);
        assertThat(source).hasContent("nuovo");
        assertThat(target).hasContent("esistente");
        assertThatThrownBy(result::orThrow)
                .isInstanceOf(FileConflictException.class)
                .satisfies(e -> assertThat(((FileConflictException) e).getTarget()).isEqualTo(target.toRealPath()));
    }

    @Test
    void overwriteReplacesTarget() throws IOException {
        Path source = write("a.pdf", "nuovo");
        Path target = write("b.pdf", "esistente");

        MoveResult result = mover.move(source, target, ConflictResolution.OVERWRITE, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.MOVED);
        assertThat(source).doesNotExist();
        assertThat(target).hasContent("nuovo");
    }

    @Test
    void overwriteRefusesDirectory() throws IOException {
        Path source = write("a.pdf", "nuovo");
        Path target = Files.createDirectory(dir.resolve("b.pdf"));

        assertThatThrownBy(() -> mover.move(source, target, ConflictResolution.OVERWRITE, true))
                .isInstanceOf(FileOperationException.class)
                .hasMessageContaining("directory");
        assertThat(source).exists();
    }

    @Test
    void renamePicksFirstFreeSuffix() throws IOException {
        write("file.pdf", "1");
        write("file_1.pdf", "2");
        Path source = write("sorgente.pdf", "3");

        MoveResult result = mover.move(source, dir.resolve("file.pdf"), ConflictResolution.RENAME, true);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.MOVED);
        assertThat(result.finalPath().getFileName().toString()).isEqualTo("file_2.pdf");
        assertThat(result.finalPath()).hasContent("3");
        assertThat(dir.resolve("file.pdf")).hasContent("1");
        assertThat(dir.resolve("file_1.pdf")).hasContent("2");
    }

    @Test
    void uniqueSiblingHandlesNamesWithoutExtension() throws IOException {
        write("README", "x");
        write(".profile", "y");

        assertThat(FileMover.uniqueSibling(dir.resolve("README")).getFileName().toString()).isEqualTo("README_1");
        assertThat(FileMover.uniqueSibling(dir.resolve(".profile")).getFileName().toString()).isEqualTo(".profile_1");
        assertThat(FileMover.uniqueSibling(dir.resolve("libero.pdf"))).isEqualTo(dir.resolve("libero.pdf"));
    }

    @Test
    void missingParentWithoutCreateDirsFails() throws IOException {
        Path source = write("a.pdf", "x");

        assertThatThrownBy(() -> mover.move(source, dir.resolve("manca/a.pdf"), ConflictResolution.SKIP, false))
                .isInstanceOf(FileOperationException.class)
                .hasMessageContaining("non esiste");
        assertThat(source).exists();
    }

    @Test
    void relativeTargetIsRejected() throws IOException {
        Path source = write("a.pdf", "x");

        assertThatThrownBy(() -> mover.move(source, Path.of("relativo.pdf"), ConflictResolution.SKIP, true))
                .isInstanceOf(FileOperationException.class);
    }

    @Test
    void reservedTargetIsAConflictUnderSkip() throws IOException {
        Path source = write("a.pdf", "x");
        Path target = dir.toRealPath().resolve("b.pdf");

        MoveResult result = mover.move(source, target, ConflictResolution.SKIP, true, target::equals);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.CONFLICT);
        assertThat(source).exists();
        assertThat(target).doesNotExist();
    }

    @Test
    void renameSkipsReservedNames() throws IOException {
        Path source = write("a.pdf", "x");
        Path real = dir.toRealPath();

        MoveResult result = mover.move(source, dir.resolve("b.pdf"), ConflictResolution.RENAME, true,
                p -> p.equals(real.resolve("b.pdf")) || p.equals(real.resolve("b_1.pdf")));

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.MOVED);
        assertThat(result.finalPath()).isEqualTo(real.resolve("b_2.pdf"));
        assertThat(result.finalPath()).hasContent("x");
    }

    @Test
    void overwriteOfReservedButAbsentTargetMoves() throws IOException {
        Path source = write("a.pdf", "x");
        Path target = dir.toRealPath().resolve("b.pdf");

        MoveResult result = mover.move(source, target, ConflictResolution.OVERWRITE, true, target::equals);

        assertThat(result.outcome()).isEqualTo(MoveResult.Outcome.MOVED);
        assertThat(target).hasContent("x");
    }

    @Test
    void permissionDeniedIsWrappedWithBothPaths() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        assumeFalse("root".equals(System.getProperty("user.name")), "root ignora i permessi");
        Path source = write("a.pdf", "x");
        Path locked = Files.createDirectories(dir.resolve("bloccata"));
        Path target = locked.resolve("a.pdf");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("r-xr-xr-x"));
        try {
            assertThatThrownBy(() -> mover.move(source, target, ConflictResolution.SKIP, true))
                    .isInstanceOf(FileMovePermissionException.class)
                    .hasMessageContaining(source.toString())
                    .hasMessageContaining(target.toString());
            assertThat(source).exists();
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwxr-xr-x"));
        }
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
