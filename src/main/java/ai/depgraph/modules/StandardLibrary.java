package ai.depgraph.modules;

import java.util.Set;

import ai.depgraph.model.SourceFiles;

/**
 * Top-level names of the Python standard library. Imports of these never resolve to project
 * files, even when the project has a module of the same name.
 */
public final class StandardLibrary {

    private static final Set<String> MODULES = Set.of(
            "__future__", "_thread", "abc", "aifc", "argparse", "array", "ast", "asynchat", "asyncio",
            "asyncore", "atexit", "audioop", "base64", "bdb", "binascii", "bisect", "builtins", "bz2",
            "calendar", "cgi", "cgitb", "chunk", "cmath", "cmd", "code", "codecs", "codeop",
            "collections", "colorsys", "compileall", "concurrent", "configparser", "contextlib",
            "contextvars", "copy", "copyreg", "cProfile", "crypt", "csv", "ctypes", "curses",
            "dataclasses", "datetime", "dbm", "decimal", "difflib", "dis", "doctest", "email",
            "encodings", "ensurepip", "enum", "errno", "faulthandler", "fcntl", "filecmp", "fileinput",
            "fnmatch", "fractions", "ftplib", "functools", "gc", "getopt", "getpass", "gettext", "glob",
            "graphlib", "grp", "gzip", "hashlib", "heapq", "hmac", "html", "http", "imaplib", "imghdr",
            "importlib", "inspect", "io", "ipaddress", "itertools", "json", "keyword", "linecache",
            "locale", "logging", "lzma", "mailbox", "marshal", "math", "mimetypes", "mmap",
            "modulefinder", "msvcrt", "multiprocessing", "netrc", "numbers", "operator", "optparse",
            "os", "pathlib", "pdb", "pickle", "pickletools", "pkgutil", "platform", "plistlib",
            "poplib", "posix", "pprint", "profile", "pstats", "pty", "pwd", "py_compile", "pyclbr",
            "pydoc", "queue", "quopri", "random", "re", "readline", "reprlib", "resource",
            "rlcompleter", "runpy", "sched", "secrets", "select", "selectors", "shelve", "shlex",
            "shutil", "signal", "site", "smtplib", "socket", "socketserver", "sqlite3", "ssl", "stat",
            "statistics", "string", "stringprep", "struct", "subprocess", "symtable", "sys",
            "sysconfig", "syslog", "tabnanny", "tarfile", "tempfile", "termios", "textwrap",
            "threading", "time", "timeit", "tkinter", "token", "tokenize", "tomllib", "trace",
            "traceback", "tracemalloc", "tty", "turtle", "types", "typing", "unicodedata", "unittest",
            "urllib", "uuid", "venv", "warnings", "wave", "weakref", "webbrowser", "winreg", "wsgiref",
            "xml", "xmlrpc", "zipapp", "zipfile", "zipimport", "zlib", "zoneinfo"
    );

    private StandardLibrary() {
    }

    /**
     * @param moduleName dotted module name; only its first segment is checked
     */
    public static boolean contains(String moduleName) {
        if (moduleName == null || moduleName.isEmpty()) {
            return false;
        }
        return MODULES.contains(SourceFiles.topLevel(moduleName));
    }
}
