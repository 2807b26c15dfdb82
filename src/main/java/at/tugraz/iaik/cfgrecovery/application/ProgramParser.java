package at.tugraz.iaik.cfgrecovery.application;

import at.tugraz.iaik.cfgrecovery.application.hooks.Hook;
import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeExpr;
import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeType;
import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import at.tugraz.iaik.cfgrecovery.application.instructions.StatementType;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a textual program listing (.jir) into a {@link Program}.
 */
public class ProgramParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProgramParser.class);

  public static final String PROGRAM_FILE_EXTENSION = "jir";

  private static final String ENTRY = ".entry ";
  private static final String HOOK = ".hook ";
  private static final String CLASS = ".class ";
  private static final String SUPER = ".super ";
  private static final String IMPLEMENTS = ".implements ";
  private static final String METHOD = ".method ";
  private static final String END_METHOD = ".end method";
  private static final String END_CLASS = ".end class";

  private static final Pattern LABEL = Pattern.compile("^([A-Za-z_$][\\w$]*):$");
  private static final Pattern IF = Pattern.compile("^if\\s+(.+?)\\s+goto\\s+(\\S+)$");
  private static final Pattern GOTO = Pattern.compile("^goto\\s+(\\S+)$");
  private static final Pattern SWITCH = Pattern.compile("^switch\\s+(\\S+)\\s+(.+)$");
  private static final Pattern RETURN = Pattern.compile("^return(\\s.*)?$");
  private static final Pattern THROW = Pattern.compile("^throw\\s+\\S.*$");
  private static final Pattern INVOKE = Pattern.compile("^(?:(\\S+)\\s*=\\s*)?invoke\\s+(\\w+)\\s+([^\\s(]+\\([^)]*\\))(.*)$");
  private static final Pattern ASSIGN = Pattern.compile("^(\\S+)\\s*=\\s*(.+)$");

  private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final Program program;
  private ProgramClass currentClass = null;
  private MethodHeader currentMethod = null;
  private final List<RawLine> methodBody = new ArrayList<>();

  private ProgramParser(String programName, File programFile) {
    this.program = new Program(programName, programFile);
  }

  public static Program parse(File programFile) throws IOException, ProgramSyntaxException {
    LOGGER.debug("Parsing program listing {}", programFile.getName());
    List<String> lines = FileUtils.readLines(programFile, StandardCharsets.UTF_8);

    return new ProgramParser(FilenameUtils.getBaseName(programFile.getName()), programFile).parseLines(lines);
  }

  public static Program parse(String programName, List<String> lines) throws ProgramSyntaxException {
    return new ProgramParser(programName, null).parseLines(lines);
  }

  private Program parseLines(List<String> lines) throws ProgramSyntaxException {
    int lineNr = 0;
    for (String rawLine : lines) {
      lineNr++;
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#"))
        continue;

      if (currentMethod != null) {
        if (line.equals(END_METHOD))
          finishMethod();
        else if (line.startsWith("."))
          throw new ProgramSyntaxException("Unexpected directive inside method: " + line, lineNr);
        else
          methodBody.add(new RawLine(line, lineNr));
        continue;
      }

      if (line.startsWith(ENTRY)) {
        program.setEntry(parseDescriptor(line.substring(ENTRY.length()), lineNr));
      } else if (line.startsWith(HOOK)) {
        parseHook(line.substring(HOOK.length()), lineNr);
      } else if (line.startsWith(CLASS)) {
        parseClassHeader(line.substring(CLASS.length()), lineNr);
      } else if (line.startsWith(SUPER)) {
        requireClass(line, lineNr).setSuperClass(line.substring(SUPER.length()).trim());
      } else if (line.startsWith(IMPLEMENTS)) {
        requireClass(line, lineNr).addImplementedInterface(line.substring(IMPLEMENTS.length()).trim());
      } else if (line.startsWith(METHOD)) {
        requireClass(line, lineNr);
        currentMethod = parseMethodHeader(line.substring(METHOD.length()), lineNr);
      } else if (line.equals(END_CLASS)) {
        requireClass(line, lineNr);
        currentClass = null;
      } else {
        throw new ProgramSyntaxException("Unexpected line outside of a method: " + line, lineNr);
      }
    }

    if (currentMethod != null)
      throw new ProgramSyntaxException("Unterminated method " + currentMethod.name, currentMethod.lineNr);
    if (currentClass != null)
      throw new ProgramSyntaxException("Unterminated class " + currentClass.getName(), lineNr);

    LOGGER.debug("Parsed {} classes with {} methods for {}", program.getAllClasses().size(),
        program.getMethodCount(), program.getProgramName());

    return program;
  }

  private ProgramClass requireClass(String line, int lineNr) throws ProgramSyntaxException {
    if (currentClass == null)
      throw new ProgramSyntaxException("Directive outside of a class: " + line, lineNr);

    return currentClass;
  }

  private void parseClassHeader(String header, int lineNr) throws ProgramSyntaxException {
    if (currentClass != null)
      throw new ProgramSyntaxException("Nested class declaration inside " + currentClass.getName(), lineNr);

    List<String> tokens = WHITESPACE.splitToList(header);
    if (tokens.isEmpty())
      throw new ProgramSyntaxException("Class declaration without a name", lineNr);

    String className = tokens.get(tokens.size() - 1);
    if (program.containsClass(className))
      throw new ProgramSyntaxException("Duplicate class " + className, lineNr);

    List<String> flags = tokens.subList(0, tokens.size() - 1);
    boolean isInterface = flags.contains("interface");
    currentClass = new ProgramClass(className, program, isInterface, isInterface || flags.contains("abstract"));
    program.addClass(currentClass);
  }

  private MethodHeader parseMethodHeader(String header, int lineNr) throws ProgramSyntaxException {
    int paramStart = header.indexOf('(');
    int paramEnd = header.indexOf(')', paramStart);
    if (paramStart < 0 || paramEnd < 0)
      throw new ProgramSyntaxException("Method declaration without parameter list: " + header, lineNr);

    List<String> tokens = WHITESPACE.splitToList(header.substring(0, paramStart));
    if (tokens.isEmpty())
      throw new ProgramSyntaxException("Method declaration without a name: " + header, lineNr);

    MethodHeader mh = new MethodHeader();
    mh.name = tokens.get(tokens.size() - 1);
    mh.modifiers = tokens.subList(0, tokens.size() - 1);
    mh.params = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(header.substring(paramStart + 1, paramEnd));
    String returnType = header.substring(paramEnd + 1).trim();
    mh.returnType = returnType.isEmpty() ? "void" : returnType;
    mh.lineNr = lineNr;

    return mh;
  }

  private void finishMethod() throws ProgramSyntaxException {
    MethodHeader mh = currentMethod;
    Map<String, Integer> labels = new HashMap<>();
    Map<String, Integer> labelLines = new HashMap<>();
    List<Statement> statements = new ArrayList<>();

    for (RawLine raw : methodBody) {
      Matcher labelMatcher = LABEL.matcher(raw.text);
      if (labelMatcher.matches()) {
        String label = labelMatcher.group(1);
        if (labels.containsKey(label))
          throw new ProgramSyntaxException("Duplicate label " + label, raw.lineNr);

        labels.put(label, statements.size());
        labelLines.put(label, raw.lineNr);
        continue;
      }

      statements.add(parseStatement(statements.size(), raw));
    }

    for (Map.Entry<String, Integer> label : labels.entrySet()) {
      if (label.getValue() >= statements.size())
        throw new ProgramSyntaxException("Label " + label.getKey() + " does not precede a statement",
            labelLines.get(label.getKey()));
    }

    for (Statement stmt : statements) {
      List<Integer> targets = new ArrayList<>();
      for (String label : stmt.getTargetLabels()) {
        Integer target = labels.get(label);
        if (target == null)
          throw new ProgramSyntaxException("Unknown label " + label, stmt.getLineNr());
        targets.add(target);
      }
      stmt.setTargets(targets);
    }

    MethodDescriptor descriptor = new MethodDescriptor(currentClass.getName(), mh.name, mh.params);
    if (currentClass.getDeclaredMethod(descriptor) != null)
      throw new ProgramSyntaxException("Duplicate method " + descriptor, mh.lineNr);

    Method method = new Method(descriptor, currentClass, mh.modifiers, mh.returnType, statements);
    if (!method.isConcrete() && method.hasBody())
      throw new ProgramSyntaxException("Abstract or native method with a body: " + descriptor, mh.lineNr);

    currentClass.addMethod(method);
    currentMethod = null;
    methodBody.clear();
  }

  private static Statement parseStatement(int id, RawLine raw) throws ProgramSyntaxException {
    String text = raw.text;
    Matcher m;

    if ((m = IF.matcher(text)).matches())
      return new Statement(id, StatementType.IF, text, raw.lineNr, null, ImmutableList.of(m.group(2)));

    if ((m = GOTO.matcher(text)).matches())
      return new Statement(id, StatementType.GOTO, text, raw.lineNr, null, ImmutableList.of(m.group(1)));

    if ((m = SWITCH.matcher(text)).matches())
      return new Statement(id, StatementType.SWITCH, text, raw.lineNr, null, parseSwitchTargets(m.group(2), raw.lineNr));

    if (RETURN.matcher(text).matches())
      return new Statement(id, StatementType.RETURN, text, raw.lineNr, null, ImmutableList.<String>of());

    if (THROW.matcher(text).matches())
      return new Statement(id, StatementType.THROW, text, raw.lineNr, null, ImmutableList.<String>of());

    if ((m = INVOKE.matcher(text)).matches()) {
      InvokeType invokeType = InvokeType.fromKeyword(m.group(2));
      if (invokeType == null)
        throw new ProgramSyntaxException("Unknown invoke kind " + m.group(2), raw.lineNr);

      InvokeExpr invokeExpr = new InvokeExpr(invokeType, parseDescriptor(m.group(3), raw.lineNr));
      StatementType type = (m.group(1) != null) ? StatementType.ASSIGN : StatementType.INVOKE;

      return new Statement(id, type, text, raw.lineNr, invokeExpr, ImmutableList.<String>of());
    }

    if (ASSIGN.matcher(text).matches())
      return new Statement(id, StatementType.ASSIGN, text, raw.lineNr, null, ImmutableList.<String>of());

    return new Statement(id, StatementType.PLAIN, text, raw.lineNr, null, ImmutableList.<String>of());
  }

  /**
   * Parses {@code L1 L2 default L3}. The default label is returned last.
   */
  private static List<String> parseSwitchTargets(String targets, int lineNr) throws ProgramSyntaxException {
    List<String> tokens = WHITESPACE.splitToList(targets);
    int defaultIdx = tokens.indexOf("default");
    if (defaultIdx < 0 || defaultIdx != tokens.size() - 2)
      throw new ProgramSyntaxException("Switch without a trailing default label", lineNr);

    return ImmutableList.<String>builder()
        .addAll(tokens.subList(0, defaultIdx))
        .add(tokens.get(defaultIdx + 1))
        .build();
  }

  /**
   * Parses {@code pkg.Cls.name(params) [length=N] [noreturn] [syscall]}.
   */
  private void parseHook(String hook, int lineNr) throws ProgramSyntaxException {
    int descriptorEnd = hook.indexOf(')');
    if (descriptorEnd < 0)
      throw new ProgramSyntaxException("Hook without method descriptor: " + hook, lineNr);

    MethodDescriptor descriptor = parseDescriptor(hook.substring(0, descriptorEnd + 1), lineNr);
    int length = 0;
    boolean returning = true;
    boolean syscall = false;

    for (String option : WHITESPACE.split(hook.substring(descriptorEnd + 1))) {
      if (option.startsWith("length=")) {
        try {
          length = Integer.parseInt(option.substring("length=".length()));
        } catch (NumberFormatException e) {
          throw new ProgramSyntaxException("Invalid hook length: " + option, lineNr);
        }
      } else if (option.equals("noreturn")) {
        returning = false;
      } else if (option.equals("syscall")) {
        syscall = true;
      } else {
        throw new ProgramSyntaxException("Unknown hook option: " + option, lineNr);
      }
    }

    if (length < 0)
      throw new ProgramSyntaxException("Invalid hook length: " + length, lineNr);

    program.getHooks().hook(Address.entryOf(descriptor), new Hook(descriptor.toString(), length, returning, syscall));
  }

  private static MethodDescriptor parseDescriptor(String descriptor, int lineNr) throws ProgramSyntaxException {
    try {
      return MethodDescriptor.parse(descriptor);
    } catch (IllegalArgumentException e) {
      throw new ProgramSyntaxException(e.getMessage(), lineNr);
    }
  }

  private static class MethodHeader {
    private String name;
    private List<String> modifiers;
    private List<String> params;
    private String returnType;
    private int lineNr;
  }

  private static class RawLine {
    private final String text;
    private final int lineNr;

    private RawLine(String text, int lineNr) {
      this.text = text;
      this.lineNr = lineNr;
    }
  }
}
